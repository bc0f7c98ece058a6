package com.ryuqq.entityservice.application.validation;

import java.util.List;

/**
 * Result of validating a command payload.
 *
 * @param valid true if validation passed with no errors
 * @param errors list of human-readable error messages (empty when valid)
 * @author Entity Service Team
 * @since 1.0.0
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** Passes when {@code errors} is empty, fails otherwise. */
    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? ok() : fail(errors);
    }
}
