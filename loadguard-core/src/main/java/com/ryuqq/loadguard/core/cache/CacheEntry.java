package com.ryuqq.loadguard.core.cache;

/**
 * 캐시 엔트리.
 *
 * @param value 저장된 값 (non-null)
 * @param expiresAtNanos 만료 시각 (Clock 기준 나노초)
 * @param <V> 값 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public record CacheEntry<V>(V value, long expiresAtNanos) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public CacheEntry {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * 만료 여부 확인.
     *
     * <p>만료 시각과 같은 시점부터 만료로 간주합니다.</p>
     *
     * @param nowNanos 현재 시각 (나노초)
     * @return 만료된 경우 true
     */
    public boolean isExpired(long nowNanos) {
        return nowNanos - expiresAtNanos >= 0;
    }
}
