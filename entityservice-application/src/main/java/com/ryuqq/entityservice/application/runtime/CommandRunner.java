package com.ryuqq.entityservice.application.runtime;

import com.ryuqq.entityservice.core.contract.Command;
import com.ryuqq.entityservice.core.contract.ResponseEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * Runs each command as an independent asynchronous task.
 *
 * <p><strong>Cancellation:</strong></p>
 * <ul>
 *   <li>Cancelling the returned future before the task starts: the command never runs and the store is never touched</li>
 *   <li>After the task has started: the pipeline runs to completion; cancellation only releases the caller</li>
 * </ul>
 *
 * <p>The returned future never completes exceptionally because of a pipeline
 * failure: every {@code Result} is already an envelope. It may complete
 * exceptionally on timeout, cancellation or rejection by a shut-down runner.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public interface CommandRunner {

    /**
     * Submits a command for asynchronous execution.
     *
     * @param command the command to run
     * @return future response envelope
     * @throws IllegalArgumentException if command is null
     */
    CompletableFuture<ResponseEnvelope<?>> submit(Command command);
}
