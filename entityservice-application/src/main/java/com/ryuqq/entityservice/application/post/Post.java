package com.ryuqq.entityservice.application.post;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityId;

import java.time.Instant;
import java.util.List;

/**
 * 게시글 엔티티.
 *
 * @param id 저장소가 할당한 식별자
 * @param title 제목
 * @param content 본문
 * @param authorId 작성자 식별자
 * @param tags 태그 (없으면 빈 목록)
 * @param published 공개 여부
 * @param createdAt 생성 시각
 * @param updatedAt 최종 수정 시각
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Post(
    EntityId id,
    String title,
    String content,
    String authorId,
    List<String> tags,
    boolean published,
    Instant createdAt,
    Instant updatedAt
) implements Entity {

    public Post {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
