package com.ryuqq.entityservice.core.spi;

/**
 * Backend or transport failure raised by an {@link EntityStore}.
 *
 * <p>The service layer translates it into an {@code Unexpected} result and never
 * publishes an event for the failed write.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
