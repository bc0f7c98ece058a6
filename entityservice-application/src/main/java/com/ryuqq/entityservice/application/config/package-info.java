/**
 * 애플리케이션 계층 설정.
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.config;
