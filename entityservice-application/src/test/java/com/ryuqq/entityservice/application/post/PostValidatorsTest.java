package com.ryuqq.entityservice.application.post;

import com.ryuqq.entityservice.application.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PostValidatorsTest {

    private final CreatePostValidator createValidator = new CreatePostValidator();
    private final UpdatePostValidator updateValidator = new UpdatePostValidator();

    @Test
    void 최소_생성_입력은_통과한다() {
        assertThat(createValidator.validate(CreatePost.of("T", "B", "u1")).valid()).isTrue();
    }

    @Test
    void 태그는_20개까지_허용된다() {
        List<String> twenty = new ArrayList<>(Collections.nCopies(20, "t"));
        List<String> twentyOne = new ArrayList<>(Collections.nCopies(21, "t"));

        assertThat(createValidator.validate(new CreatePost("T", "B", "u1", twenty, null)).valid()).isTrue();
        assertThat(createValidator.validate(new CreatePost("T", "B", "u1", twentyOne, null)).errors())
            .containsExactly("tags must contain at most 20 entries");
    }

    @Test
    void 수정시_빈_제목은_거부된다() {
        ValidationResult result = updateValidator.validate(new UpdatePost(" ", null, null, null));

        assertThat(result.errors()).containsExactly("title must not be blank");
    }

    @Test
    void 수정시_아무_필드도_없으면_거부된다() {
        ValidationResult result = updateValidator.validate(new UpdatePost(null, null, null, null));

        assertThat(result.errors()).containsExactly("at least one field must be set");
    }

    @Test
    void 공개_여부만_바꾸는_수정은_통과한다() {
        assertThat(updateValidator.validate(new UpdatePost(null, null, null, true)).valid()).isTrue();
    }
}
