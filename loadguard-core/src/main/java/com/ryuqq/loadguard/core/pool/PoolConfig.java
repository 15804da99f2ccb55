package com.ryuqq.loadguard.core.pool;

/**
 * Resource Pool 설정.
 *
 * @param poolSize 리소스 수 (양수, 초기화 시 모두 생성)
 * @param defaultAcquireTimeoutMs acquire() 기본 대기 시간 (밀리초, 0 이상)
 * @param fair true면 대기자를 FIFO 순서로 깨움
 * @author LoadGuard Team
 * @since 1.0.0
 */
public record PoolConfig(int poolSize, long defaultAcquireTimeoutMs, boolean fair) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: poolSize=10, defaultAcquireTimeoutMs=1000ms, fair=true</p>
     */
    public PoolConfig() {
        this(10, 1000, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PoolConfig {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive (current: " + poolSize + ")");
        }
        if (defaultAcquireTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "defaultAcquireTimeoutMs cannot be negative (current: " + defaultAcquireTimeoutMs + ")"
            );
        }
    }

    /**
     * poolSize만 변경한 새 인스턴스 생성.
     */
    public PoolConfig withPoolSize(int poolSize) {
        return new PoolConfig(poolSize, defaultAcquireTimeoutMs, fair);
    }

    /**
     * defaultAcquireTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public PoolConfig withDefaultAcquireTimeoutMs(long defaultAcquireTimeoutMs) {
        return new PoolConfig(poolSize, defaultAcquireTimeoutMs, fair);
    }

    /**
     * fair만 변경한 새 인스턴스 생성.
     */
    public PoolConfig withFair(boolean fair) {
        return new PoolConfig(poolSize, defaultAcquireTimeoutMs, fair);
    }
}
