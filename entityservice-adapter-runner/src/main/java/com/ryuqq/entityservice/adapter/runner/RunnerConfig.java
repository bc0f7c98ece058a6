package com.ryuqq.entityservice.adapter.runner;

/**
 * AsyncCommandRunner / InboundMessagePump 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: pump() 한 번에 인박스에서 꺼낼 메시지 수 (기본 10)</li>
 *   <li>concurrency: 명령 실행 워커 스레드 수 (기본 5)</li>
 *   <li>commandTimeoutMs: 호출자가 응답을 기다리는 최대 시간 (기본 30000ms = 30초)</li>
 * </ul>
 *
 * <p>concurrency는 동시에 저장소를 호출하는 명령 수의 상한입니다. 타임아웃은 호출자만 해제하며
 * 이미 시작된 명령은 끝까지 실행되므로, 저장소가 느리면 concurrency보다 commandTimeoutMs를 먼저 늘립니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 워커 스레드 수 (1 이상이어야 함)
 * @param commandTimeoutMs 응답 대기 시간 (밀리초, 양수여야 함)
 */
public record RunnerConfig(
    int batchSize,
    int concurrency,
    long commandTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=10, concurrency=5, commandTimeoutMs=30000ms</p>
     */
    public RunnerConfig() {
        this(10, 5, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunnerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (commandTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "commandTimeoutMs must be positive (current: " + commandTimeoutMs + ")"
            );
        }
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withBatchSize(int batchSize) {
        return new RunnerConfig(batchSize, concurrency, commandTimeoutMs);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withConcurrency(int concurrency) {
        return new RunnerConfig(batchSize, concurrency, commandTimeoutMs);
    }

    /**
     * commandTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withCommandTimeoutMs(long commandTimeoutMs) {
        return new RunnerConfig(batchSize, concurrency, commandTimeoutMs);
    }
}
