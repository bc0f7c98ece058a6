package com.ryuqq.entityservice.application.post;

import java.util.List;

/**
 * create_post 페이로드. tags와 published는 생략 가능합니다 (빈 목록, false).
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record CreatePost(
    String title,
    String content,
    String authorId,
    List<String> tags,
    Boolean published
) {

    public static CreatePost of(String title, String content, String authorId) {
        return new CreatePost(title, content, authorId, null, null);
    }
}
