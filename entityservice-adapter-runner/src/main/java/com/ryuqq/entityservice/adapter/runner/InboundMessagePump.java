package com.ryuqq.entityservice.adapter.runner;

import com.ryuqq.entityservice.application.dispatcher.CommandDispatcher;
import com.ryuqq.entityservice.application.dispatcher.StatusCodes;
import com.ryuqq.entityservice.application.runtime.CommandRunner;
import com.ryuqq.entityservice.application.runtime.Runtime;
import com.ryuqq.entityservice.core.contract.Command;
import com.ryuqq.entityservice.core.contract.InboundMessage;
import com.ryuqq.entityservice.core.contract.ResponseEnvelope;
import com.ryuqq.entityservice.core.spi.MessageInbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * 인박스 폴링 기반 {@link Runtime} 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump()
 *   ↓
 * 1. MessageInbox.poll(batchSize)
 * 2. 각 메시지:
 *    - 명령: CommandRunner.submit → 완료 시 reply (타임아웃/실패 시 500 봉투)
 *    - 이벤트: CommandDispatcher.dispatchEvent (호출 스레드에서 처리)
 * 3. 처리한 메시지 수 반환
 * </pre>
 *
 * <p>메시지 하나의 실패는 로그만 남기며 배치의 나머지와 이후 pump() 호출을 막지 않습니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class InboundMessagePump implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(InboundMessagePump.class);

    private final MessageInbox inbox;
    private final CommandRunner runner;
    private final CommandDispatcher dispatcher;
    private final RunnerConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param inbox 메시지 인박스
     * @param runner 명령 실행기
     * @param dispatcher 이벤트 디스패치용
     * @param config 설정
     * @param clock 실패 봉투 timestamp용
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InboundMessagePump(MessageInbox inbox, CommandRunner runner, CommandDispatcher dispatcher,
                              RunnerConfig config, Clock clock) {
        if (inbox == null) {
            throw new IllegalArgumentException("inbox cannot be null");
        }
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.inbox = inbox;
        this.runner = runner;
        this.dispatcher = dispatcher;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public int pump() {
        List<InboundMessage> batch = inbox.poll(config.batchSize());
        for (InboundMessage message : batch) {
            try {
                process(message);
            } catch (RuntimeException e) {
                log.error("Failed to process inbound message {}", describe(message), e);
                if (message.isCommand()) {
                    safeReply(message, failure(message.command(), e));
                }
            }
        }
        return batch.size();
    }

    private void process(InboundMessage message) {
        if (!message.isCommand()) {
            dispatcher.dispatchEvent(message.event());
            return;
        }
        runner.submit(message.command()).whenComplete((envelope, error) -> {
            if (error == null) {
                safeReply(message, envelope);
            } else {
                log.warn("Command {} ({}) did not complete: {}",
                    message.command().pattern(), message.correlationId(), unwrap(error).toString());
                safeReply(message, failure(message.command(), error));
            }
        });
    }

    private void safeReply(InboundMessage message, ResponseEnvelope<?> response) {
        try {
            inbox.reply(message, response);
        } catch (RuntimeException e) {
            log.error("Failed to reply to {}", message.correlationId(), e);
        }
    }

    private ResponseEnvelope<?> failure(Command command, Throwable error) {
        Throwable cause = unwrap(error);
        String message;
        if (cause instanceof TimeoutException) {
            message = "Request timed out";
        } else if (cause instanceof CancellationException) {
            message = "Request cancelled";
        } else {
            message = "Internal server error";
        }
        return ResponseEnvelope.failure(
            message, command.kind().collectionPath(), StatusCodes.INTERNAL_ERROR, Instant.now(clock).toString()
        );
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static String describe(InboundMessage message) {
        return message.isCommand()
            ? message.command().pattern() + " (" + message.correlationId() + ")"
            : message.event().name().value();
    }
}
