package com.ryuqq.loadguard.core.spi;

import com.ryuqq.loadguard.core.cache.CacheEntry;
import com.ryuqq.loadguard.core.model.Fingerprint;

import java.util.Optional;

/**
 * Result Cache 엔트리 저장소 SPI.
 *
 * <p>만료 판단은 호출자(Result Cache)의 책임이며, 저장소는 엔트리를 그대로 보관합니다.
 * 단, {@link #removeExpired(long)}는 저장소가 직접 만료 여부를 평가합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong> thread-safe, 모든 연산은 키 단위로 원자적</p>
 *
 * @param <V> 값 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface CacheStore<V> {

    /**
     * 엔트리 조회 (만료 여부와 무관).
     *
     * @param fingerprint 키
     * @return 엔트리 (없으면 empty)
     * @throws IllegalArgumentException fingerprint가 null인 경우
     */
    Optional<CacheEntry<V>> get(Fingerprint fingerprint);

    /**
     * 엔트리 저장 (덮어쓰기).
     *
     * @param fingerprint 키
     * @param entry 엔트리
     * @throws IllegalArgumentException fingerprint 또는 entry가 null인 경우
     */
    void put(Fingerprint fingerprint, CacheEntry<V> entry);

    /**
     * 엔트리 제거.
     *
     * @param fingerprint 키
     * @return 제거된 경우 true
     */
    boolean remove(Fingerprint fingerprint);

    /**
     * 저장된 엔트리가 expected와 같은 인스턴스일 때만 제거.
     *
     * <p>만료 엔트리를 지연 제거할 때, 그 사이 새로 저장된 엔트리를 지우지 않기 위해 사용합니다.</p>
     *
     * @param fingerprint 키
     * @param expected 제거 대상 엔트리
     * @return 제거된 경우 true
     */
    boolean removeIfSame(Fingerprint fingerprint, CacheEntry<V> expected);

    /**
     * 만료된 엔트리 일괄 제거.
     *
     * @param nowNanos 현재 시각 (나노초)
     * @return 제거된 엔트리 수
     */
    int removeExpired(long nowNanos);

    /**
     * 저장된 엔트리 수.
     *
     * @return 엔트리 수
     */
    int size();

    /**
     * 모든 엔트리 제거.
     */
    void clear();
}
