package com.ryuqq.entityservice.core.model;

import java.time.Instant;

/**
 * 저장소에 보관되는 엔티티의 공통 형태.
 *
 * <p>식별자와 생성/수정 시각은 저장소가 채웁니다. 나머지 필드는 엔티티 종류별 스키마가 정의합니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public interface Entity {

    /**
     * 저장소가 할당한 식별자.
     *
     * @return 식별자
     */
    EntityId id();

    /**
     * 생성 시각 (저장소가 기록, null 가능).
     *
     * @return 생성 시각
     */
    Instant createdAt();

    /**
     * 최종 수정 시각 (저장소가 기록, null 가능).
     *
     * @return 최종 수정 시각
     */
    Instant updatedAt();
}
