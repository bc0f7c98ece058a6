package com.ryuqq.entityservice.application.validation;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field checks shared by the entity validators.
 *
 * <p>Each check appends a human-readable message to the caller's error list and never
 * throws, so a validator can report every violation of a payload at once.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class FieldRules {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private FieldRules() {
        // utility class
    }

    public static void required(String field, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + " is required");
        }
    }

    /** Null is allowed (field not being set); blank is not. */
    public static void notBlankIfPresent(String field, String value, List<String> errors) {
        if (value != null && value.isBlank()) {
            errors.add(field + " must not be blank");
        }
    }

    public static void maxLength(String field, String value, int max, List<String> errors) {
        if (value != null && value.length() > max) {
            errors.add(field + " must be at most " + max + " characters");
        }
    }

    public static void email(String field, String value, List<String> errors) {
        if (value != null && !value.isBlank() && !EMAIL.matcher(value.trim()).matches()) {
            errors.add(field + " must be a valid email address");
        }
    }

    public static void maxSize(String field, Collection<?> values, int max, List<String> errors) {
        if (values != null && values.size() > max) {
            errors.add(field + " must contain at most " + max + " entries");
        }
    }

    public static void noBlankEntries(String field, Collection<String> values, List<String> errors) {
        if (values != null && values.stream().anyMatch(v -> v == null || v.isBlank())) {
            errors.add(field + " must not contain blank entries");
        }
    }
}
