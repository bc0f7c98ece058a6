package com.ryuqq.entityservice.application.user;

import com.ryuqq.entityservice.application.validation.FieldRules;
import com.ryuqq.entityservice.application.validation.ValidationResult;
import com.ryuqq.entityservice.application.validation.Validator;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates update_user updateData. At least one field must be set.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class UpdateUserValidator implements Validator<UpdateUser> {

    @Override
    public ValidationResult validate(UpdateUser input) {
        List<String> errors = new ArrayList<>();
        if (input.isEmpty()) {
            errors.add("at least one field must be set");
            return ValidationResult.fail(errors);
        }
        FieldRules.notBlankIfPresent("email", input.email(), errors);
        FieldRules.email("email", input.email(), errors);
        FieldRules.notBlankIfPresent("password", input.password(), errors);
        FieldRules.notBlankIfPresent("name", input.name(), errors);
        FieldRules.maxLength("name", input.name(), CreateUserValidator.NAME_MAX_LENGTH, errors);
        return ValidationResult.of(errors);
    }
}
