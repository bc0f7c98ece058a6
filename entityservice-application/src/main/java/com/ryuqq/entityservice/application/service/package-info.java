/**
 * 명령 → 저장 → 이벤트 파이프라인.
 *
 * <p>{@link com.ryuqq.entityservice.application.service.EntityService}가 검증, 존재 확인,
 * 유일성 확인, 저장, best-effort 이벤트 발행 순서를 고정하고, 엔티티별 서비스
 * ({@code UserService}, {@code PostService})는 검증 규칙과 필드 준비만 정의합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.service;
