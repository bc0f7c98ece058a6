package com.ryuqq.entityservice.core.model;

/**
 * 이벤트가 알리는 상태 전이 유형.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public enum Transition {

    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted");

    private final String suffix;

    Transition(String suffix) {
        this.suffix = suffix;
    }

    /**
     * 이벤트 이름 접미사 (예: created).
     *
     * @return 접미사
     */
    public String suffix() {
        return suffix;
    }

    /**
     * 접미사로 Transition 조회.
     *
     * @param suffix 접미사
     * @return Transition
     * @throws IllegalArgumentException 알 수 없는 접미사인 경우
     */
    public static Transition fromSuffix(String suffix) {
        for (Transition transition : values()) {
            if (transition.suffix.equals(suffix)) {
                return transition;
            }
        }
        throw new IllegalArgumentException("Unknown transition suffix: " + suffix);
    }
}
