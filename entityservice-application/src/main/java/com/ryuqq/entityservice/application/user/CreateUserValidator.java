package com.ryuqq.entityservice.application.user;

import com.ryuqq.entityservice.application.validation.FieldRules;
import com.ryuqq.entityservice.application.validation.ValidationResult;
import com.ryuqq.entityservice.application.validation.Validator;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates create_user payloads: required email and password, optional name up to 100 characters.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class CreateUserValidator implements Validator<CreateUser> {

    static final int NAME_MAX_LENGTH = 100;

    @Override
    public ValidationResult validate(CreateUser input) {
        List<String> errors = new ArrayList<>();
        FieldRules.required("email", input.email(), errors);
        FieldRules.email("email", input.email(), errors);
        FieldRules.required("password", input.password(), errors);
        FieldRules.notBlankIfPresent("name", input.name(), errors);
        FieldRules.maxLength("name", input.name(), NAME_MAX_LENGTH, errors);
        return ValidationResult.of(errors);
    }
}
