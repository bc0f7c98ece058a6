package com.ryuqq.entityservice.application.codec;

/**
 * Raised when a payload cannot be read or written as JSON.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class PayloadCodecException extends RuntimeException {

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
