/**
 * Runner Adapter Layer - 비동기 명령 실행과 인박스 폴링.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.entityservice.adapter.runner.AsyncCommandRunner} - 명령별 비동기 작업 실행</li>
 *   <li>{@link com.ryuqq.entityservice.adapter.runner.InboundMessagePump} - 인박스 폴링 Runtime</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (AsyncCommandRunner, InboundMessagePump)
 *   ↓ implements
 * application (CommandRunner, Runtime)
 *   ↓ depends on
 * core (Command, InboundMessage, ResponseEnvelope, MessageInbox)
 * </pre>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
package com.ryuqq.entityservice.adapter.runner;
