package com.ryuqq.entityservice.core.spi;

import com.ryuqq.entityservice.core.contract.InboundMessage;
import com.ryuqq.entityservice.core.contract.ResponseEnvelope;

import java.util.List;

/**
 * Inbound side of the message bus: commands awaiting a reply and events.
 *
 * <p>The bus is assumed reliable with ordered per-publisher delivery to a single
 * consumer group. Events may be delivered more than once.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * List&lt;InboundMessage&gt; batch = inbox.poll(10);
 * for (InboundMessage message : batch) {
 *     if (message.isCommand()) {
 *         inbox.reply(message, dispatcher.dispatch(message.command()));
 *     } else {
 *         dispatcher.dispatchEvent(message.event());
 *     }
 * }
 * </pre>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public interface MessageInbox {

    /**
     * Takes up to {@code batchSize} pending messages without blocking.
     *
     * @param batchSize maximum number of messages
     * @return pending messages (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<InboundMessage> poll(int batchSize);

    /**
     * Sends the response for a command message back to its requester.
     *
     * <p>Replying to an unknown or already answered correlation id is ignored.</p>
     *
     * @param message the command message being answered
     * @param response the response envelope
     * @throws IllegalArgumentException if message is null, not a command, or response is null
     */
    void reply(InboundMessage message, ResponseEnvelope<?> response);
}
