package com.ryuqq.entityservice.core.contract;

import com.ryuqq.entityservice.core.model.EntityKind;

/**
 * 엔티티 종류와 무관하게 공통으로 지원하는 명령 이름.
 *
 * <p>각 명령은 와이어 패턴을 가집니다 (kind = post 기준):</p>
 * <ul>
 *   <li>CREATE → create_post</li>
 *   <li>READ_ALL → get_posts</li>
 *   <li>READ_ONE → get_post</li>
 *   <li>UPDATE → update_post</li>
 *   <li>DELETE → delete_post</li>
 * </ul>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public enum CommandName {

    CREATE,
    READ_ALL,
    READ_ONE,
    UPDATE,
    DELETE;

    /**
     * 변경(mutation) 명령 여부.
     *
     * @return 변경 명령이면 true
     */
    public boolean isMutation() {
        return this == CREATE || this == UPDATE || this == DELETE;
    }

    /**
     * 주어진 엔티티 종류에 대한 와이어 패턴.
     *
     * @param kind 엔티티 종류
     * @return 와이어 패턴 (예: create_post)
     */
    public String patternFor(EntityKind kind) {
        return switch (this) {
            case CREATE -> "create_" + kind.getValue();
            case READ_ALL -> "get_" + kind.plural();
            case READ_ONE -> "get_" + kind.getValue();
            case UPDATE -> "update_" + kind.getValue();
            case DELETE -> "delete_" + kind.getValue();
        };
    }
}
