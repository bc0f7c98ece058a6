package com.ryuqq.entityservice.core.spi;

/**
 * Outcome of one publish attempt.
 *
 * @param delivered whether the bus accepted the event
 * @param error failure description (null when delivered)
 * @author Entity Service Team
 * @since 1.0.0
 */
public record PublishOutcome(boolean delivered, String error) {

    public PublishOutcome {
        if (!delivered && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error cannot be null or blank for a failed publish");
        }
    }

    public static PublishOutcome ok() {
        return new PublishOutcome(true, null);
    }

    public static PublishOutcome failed(String error) {
        return new PublishOutcome(false, error);
    }
}
