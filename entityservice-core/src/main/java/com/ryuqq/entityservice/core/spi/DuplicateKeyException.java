package com.ryuqq.entityservice.core.spi;

/**
 * Unique constraint violation raised by an {@link EntityStore} write.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class DuplicateKeyException extends StorageException {

    private final String field;

    public DuplicateKeyException(String field) {
        super("Duplicate value for unique field: " + field);
        this.field = field;
    }

    /**
     * The unique field whose value is already taken.
     *
     * @return field name
     */
    public String getField() {
        return field;
    }
}
