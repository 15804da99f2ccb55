package com.ryuqq.loadguard.adapter.runner;

/**
 * CacheSweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>sweepIntervalMs: 만료 엔트리 정리 주기 (기본 30000ms = 30초)</li>
 *   <li>shutdownTimeoutMs: stop() 시 진행 중인 정리 작업 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p>TTL보다 훨씬 짧은 주기는 의미가 적습니다. 만료 엔트리는 조회 시에도 지연 제거되므로
 * Sweeper는 다시 조회되지 않는 엔트리의 메모리 회수만 담당합니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 * @param sweepIntervalMs 정리 주기 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record CacheSweeperConfig(long sweepIntervalMs, long shutdownTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: sweepIntervalMs=30000ms, shutdownTimeoutMs=5000ms</p>
     */
    public CacheSweeperConfig() {
        this(30000, 5000);
    }

    public CacheSweeperConfig {
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "sweepIntervalMs must be positive (current: " + sweepIntervalMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * sweepIntervalMs만 변경한 새 인스턴스 생성.
     */
    public CacheSweeperConfig withSweepIntervalMs(long sweepIntervalMs) {
        return new CacheSweeperConfig(sweepIntervalMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CacheSweeperConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new CacheSweeperConfig(sweepIntervalMs, shutdownTimeoutMs);
    }
}
