/**
 * Runtime 인터페이스 및 관련 컴포넌트.
 *
 * <p>이 패키지는 수신 메시지 처리를 위한 인터페이스를 제공합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.entityservice.application.runtime.Runtime} - 인박스 폴링 및 메시지 처리</li>
 *   <li>{@link com.ryuqq.entityservice.application.runtime.CommandRunner} - 명령별 비동기 실행</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code InboundMessagePump}, {@code AsyncCommandRunner}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.runtime;
