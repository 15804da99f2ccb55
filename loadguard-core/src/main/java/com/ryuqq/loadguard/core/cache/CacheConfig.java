package com.ryuqq.loadguard.core.cache;

import java.util.concurrent.TimeUnit;

/**
 * Result Cache 설정.
 *
 * @param ttlMs 엔트리 유효 시간 (밀리초, 양수)
 * @author LoadGuard Team
 * @since 1.0.0
 */
public record CacheConfig(long ttlMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: ttlMs=60000ms (1분)</p>
     */
    public CacheConfig() {
        this(60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException ttlMs가 양수가 아닌 경우
     */
    public CacheConfig {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
    }

    /**
     * TTL (나노초).
     *
     * @return ttlMs를 나노초로 환산한 값
     */
    public long ttlNanos() {
        return TimeUnit.MILLISECONDS.toNanos(ttlMs);
    }
}
