package com.ryuqq.entityservice.application.runtime;

/**
 * Inbound message runtime.
 *
 * <p>This interface defines the polling loop that drains the message inbox
 * and feeds commands and events to the dispatcher.</p>
 *
 * <p><strong>Runtime Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. Poll a batch from the MessageInbox
 * 2. For each message:
 *    a. Command → run via CommandRunner → reply with the envelope
 *       (timeout or runner failure → reply with a 500 envelope)
 *    b. Event → dispatch to the owning service's handler
 * 3. Return the number of processed messages
 * </pre>
 *
 * <p><strong>Error Handling:</strong> one failing message is logged and
 * never stops the rest of the batch or later calls to {@code pump()}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * scheduler.scheduleWithFixedDelay(runtime::pump, 0, 100, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Processes one batch of inbound messages.
     *
     * @return number of messages processed in this call
     */
    int pump();
}
