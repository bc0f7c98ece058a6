package com.ryuqq.entityservice.core.contract;

import com.ryuqq.entityservice.core.model.EventName;
import com.ryuqq.entityservice.core.model.Payload;

/**
 * 버스를 통해 전달되는 도메인 이벤트.
 *
 * <p>이벤트는 명령이 아니라 이미 일어난 사실에 대한 알림이며,
 * 소비자는 중복 전달을 허용해야 합니다 (at-least-once).</p>
 *
 * @param name 이벤트 이름 (예: user_created)
 * @param payload 이벤트 본문 (생성/수정: 엔티티 전체, 삭제: {"id": ...})
 * @param occurredAt 발행 시각 (epoch millis)
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record EventMessage(
    EventName name,
    Payload payload,
    long occurredAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 occurredAt이 음수인 경우
     */
    public EventMessage {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (occurredAt < 0) {
            throw new IllegalArgumentException("occurredAt must be non-negative (current: " + occurredAt + ")");
        }
    }

    /**
     * 현재 시각으로 EventMessage 생성.
     *
     * @param name 이벤트 이름
     * @param payload 이벤트 본문
     * @return EventMessage 인스턴스
     */
    public static EventMessage now(EventName name, Payload payload) {
        return new EventMessage(name, payload, System.currentTimeMillis());
    }
}
