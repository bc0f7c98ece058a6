package com.ryuqq.entityservice.application.validation;

/**
 * Pure validation of a command payload, independent of the store.
 *
 * @param <T> payload type
 * @author Entity Service Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator<T> {

    /**
     * Validates the payload.
     *
     * @param value payload (never null)
     * @return validation result listing every violation found
     */
    ValidationResult validate(T value);
}
