package com.ryuqq.entityservice.application.post;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * update_post의 updateData. null 필드는 변경하지 않으며 작성자는 바꿀 수 없습니다.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record UpdatePost(
    String title,
    String content,
    List<String> tags,
    Boolean published
) {

    public static UpdatePost title(String title) {
        return new UpdatePost(title, null, null, null);
    }

    @JsonIgnore
    boolean isEmpty() {
        return title == null && content == null && tags == null && published == null;
    }
}
