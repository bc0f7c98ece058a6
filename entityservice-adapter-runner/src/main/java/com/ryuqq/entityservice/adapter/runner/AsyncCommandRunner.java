package com.ryuqq.entityservice.adapter.runner;

import com.ryuqq.entityservice.application.dispatcher.CommandDispatcher;
import com.ryuqq.entityservice.application.runtime.CommandRunner;
import com.ryuqq.entityservice.core.contract.Command;
import com.ryuqq.entityservice.core.contract.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 명령마다 독립적인 비동기 작업을 실행하는 {@link CommandRunner}.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * submit(command)
 *   ↓
 * 1. 워커 풀(concurrency)에 작업 제출
 * 2. 작업 시작 시 future가 이미 취소되었으면 아무것도 하지 않음 (저장소 미접근)
 * 3. CommandDispatcher.dispatch(command) → future 완료
 * 4. commandTimeoutMs 경과 시 future는 TimeoutException으로 완료 (작업 자체는 계속 진행)
 * </pre>
 *
 * <p>호출 스레드를 점유하지 않으며, 시작 이후에는 취소되더라도 파이프라인이 끝까지 실행됩니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class AsyncCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(AsyncCommandRunner.class);

    private final CommandDispatcher dispatcher;
    private final RunnerConfig config;
    private final ExecutorService workerExecutor;

    /**
     * 생성자.
     *
     * @param dispatcher 명령 디스패처
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AsyncCommandRunner(CommandDispatcher dispatcher, RunnerConfig config) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.dispatcher = dispatcher;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public CompletableFuture<ResponseEnvelope<?>> submit(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }

        CompletableFuture<ResponseEnvelope<?>> future = new CompletableFuture<>();
        try {
            workerExecutor.execute(() -> run(command, future));
        } catch (RejectedExecutionException e) {
            log.warn("Runner rejected {}: runner is shut down", command.pattern());
            future.completeExceptionally(e);
            return future;
        }
        return future.orTimeout(config.commandTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 작업이
     * 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private void run(Command command, CompletableFuture<ResponseEnvelope<?>> future) {
        if (future.isDone()) {
            // cancelled or timed out before start: never touch the store
            log.info("Skipped {}: caller gave up before start", command.pattern());
            return;
        }
        try {
            ResponseEnvelope<?> envelope = dispatcher.dispatch(command);
            if (!future.complete(envelope)) {
                log.info("{} finished after its caller stopped waiting (status {})", command.pattern(), envelope.statusCode());
            }
        } catch (RuntimeException e) {
            log.error("Dispatcher failed for {}", command.pattern(), e);
            future.completeExceptionally(e);
        }
    }
}
