package com.ryuqq.entityservice.core.model;

/**
 * 도메인 이벤트 이름 ({@code <kind>_<transition>}).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>EventName.of(EntityKind.of("user"), Transition.CREATED) → user_created</li>
 *   <li>EventName.parse("post_deleted") → (post, DELETED)</li>
 * </ul>
 *
 * @param kind 엔티티 종류
 * @param transition 상태 전이 유형
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record EventName(EntityKind kind, Transition transition) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 transition이 null인 경우
     */
    public EventName {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
    }

    /**
     * EventName 생성.
     *
     * @param kind 엔티티 종류
     * @param transition 상태 전이 유형
     * @return EventName 인스턴스
     */
    public static EventName of(EntityKind kind, Transition transition) {
        return new EventName(kind, transition);
    }

    /**
     * 와이어 이름 파싱 (예: post_created).
     *
     * @param value 와이어 이름
     * @return EventName 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static EventName parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("event name cannot be null or blank");
        }
        int separator = value.lastIndexOf('_');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("event name must look like <kind>_<transition>: " + value);
        }
        return new EventName(
            EntityKind.of(value.substring(0, separator)),
            Transition.fromSuffix(value.substring(separator + 1))
        );
    }

    /**
     * 와이어 이름 (예: user_created).
     *
     * @return 와이어 이름
     */
    public String value() {
        return kind.getValue() + "_" + transition.suffix();
    }

    @Override
    public String toString() {
        return value();
    }
}
