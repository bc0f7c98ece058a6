package com.ryuqq.entityservice.application.post;

import com.ryuqq.entityservice.application.validation.FieldRules;
import com.ryuqq.entityservice.application.validation.ValidationResult;
import com.ryuqq.entityservice.application.validation.Validator;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates update_post updateData.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class UpdatePostValidator implements Validator<UpdatePost> {

    @Override
    public ValidationResult validate(UpdatePost input) {
        List<String> errors = new ArrayList<>();
        if (input.isEmpty()) {
            errors.add("at least one field must be set");
            return ValidationResult.fail(errors);
        }
        FieldRules.notBlankIfPresent("title", input.title(), errors);
        FieldRules.maxLength("title", input.title(), CreatePostValidator.TITLE_MAX_LENGTH, errors);
        FieldRules.notBlankIfPresent("content", input.content(), errors);
        FieldRules.noBlankEntries("tags", input.tags(), errors);
        FieldRules.maxSize("tags", input.tags(), CreatePostValidator.MAX_TAGS, errors);
        return ValidationResult.of(errors);
    }
}
