package com.ryuqq.entityservice.application.post;

import com.ryuqq.entityservice.application.validation.FieldRules;
import com.ryuqq.entityservice.application.validation.ValidationResult;
import com.ryuqq.entityservice.application.validation.Validator;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates create_post payloads.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class CreatePostValidator implements Validator<CreatePost> {

    static final int TITLE_MAX_LENGTH = 200;
    static final int MAX_TAGS = 20;

    @Override
    public ValidationResult validate(CreatePost input) {
        List<String> errors = new ArrayList<>();
        FieldRules.required("title", input.title(), errors);
        FieldRules.maxLength("title", input.title(), TITLE_MAX_LENGTH, errors);
        FieldRules.required("content", input.content(), errors);
        FieldRules.required("authorId", input.authorId(), errors);
        FieldRules.noBlankEntries("tags", input.tags(), errors);
        FieldRules.maxSize("tags", input.tags(), MAX_TAGS, errors);
        return ValidationResult.of(errors);
    }
}
