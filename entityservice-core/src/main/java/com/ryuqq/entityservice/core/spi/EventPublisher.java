package com.ryuqq.entityservice.core.spi;

import com.ryuqq.entityservice.core.model.EventName;
import com.ryuqq.entityservice.core.model.Payload;

/**
 * Fire-and-forget event publication SPI.
 *
 * <p>Callers that need certainty of delivery must reconcile externally. The
 * publisher does no retry, no backoff and no re-sequencing: ordering within one
 * identifier's event stream relies on the bus's per-producer ordering.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: may be called concurrently by many command tasks</li>
 *   <li>Non-stalling: must not block the command path indefinitely</li>
 *   <li>Prefer returning {@link PublishOutcome#failed(String)} over throwing; callers tolerate both</li>
 * </ul>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public interface EventPublisher {

    /**
     * Publishes a named event.
     *
     * @param name event name (e.g. {@code user_created})
     * @param payload serialized event body
     * @return delivery attempt outcome
     * @throws IllegalArgumentException if name or payload is null
     */
    PublishOutcome publish(EventName name, Payload payload);
}
