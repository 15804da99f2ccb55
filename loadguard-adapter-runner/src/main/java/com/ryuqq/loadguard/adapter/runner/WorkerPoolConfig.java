package com.ryuqq.loadguard.adapter.runner;

/**
 * Worker Pool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: 워커 스레드 수 (기본 4)</li>
 *   <li>queueCapacity: 대기 큐 용량, 0이면 무제한 (기본 1000)</li>
 *   <li>pollingIntervalMs: await() 폴링 간격 (기본 10ms)</li>
 *   <li>shutdownTimeoutMs: shutdown() 시 실행 중인 작업 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * <p><strong>큐 용량 설정 가이드:</strong></p>
 * <ul>
 *   <li>작업 유입이 처리량을 넘는 상황에서 무제한 큐는 메모리를 계속 소비합니다</li>
 *   <li>유한 큐는 가득 찬 시점에 submit()을 즉시 거절하여 호출자에게 배압을 전달합니다</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 * @param workerCount 워커 스레드 수 (1 이상)
 * @param queueCapacity 대기 큐 용량 (0 이상, 0은 무제한)
 * @param pollingIntervalMs 폴링 간격 (밀리초, 양수)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수)
 */
public record WorkerPoolConfig(
    int workerCount,
    int queueCapacity,
    long pollingIntervalMs,
    long shutdownTimeoutMs
) {

    /** 무제한 큐를 의미하는 queueCapacity 값. */
    public static final int UNBOUNDED = 0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerCount=4, queueCapacity=1000, pollingIntervalMs=10ms, shutdownTimeoutMs=30000ms</p>
     */
    public WorkerPoolConfig() {
        this(4, 1000, 10, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerPoolConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException(
                "workerCount must be positive (current: " + workerCount + ")"
            );
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException(
                "queueCapacity cannot be negative (current: " + queueCapacity + ")"
            );
        }
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * 무제한 큐 여부.
     *
     * @return queueCapacity가 0이면 true
     */
    public boolean isUnbounded() {
        return queueCapacity == UNBOUNDED;
    }

    public WorkerPoolConfig withWorkerCount(int workerCount) {
        return new WorkerPoolConfig(workerCount, queueCapacity, pollingIntervalMs, shutdownTimeoutMs);
    }

    public WorkerPoolConfig withQueueCapacity(int queueCapacity) {
        return new WorkerPoolConfig(workerCount, queueCapacity, pollingIntervalMs, shutdownTimeoutMs);
    }

    public WorkerPoolConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new WorkerPoolConfig(workerCount, queueCapacity, pollingIntervalMs, shutdownTimeoutMs);
    }

    public WorkerPoolConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkerPoolConfig(workerCount, queueCapacity, pollingIntervalMs, shutdownTimeoutMs);
    }
}
