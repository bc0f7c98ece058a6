/**
 * Store-independent payload validation.
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.validation;
