/**
 * In-memory document store adapter.
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.adapter.inmemory.store;
