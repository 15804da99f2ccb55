package com.ryuqq.loadguard.core.spi;

import com.ryuqq.loadguard.core.admission.TokenBucket;

import java.util.Optional;
import java.util.function.Function;

/**
 * 키별 Token Bucket 저장소 SPI.
 *
 * <p>Admission Controller의 키별 상태를 프로세스 전역 싱글톤이 아닌 주입 가능한 저장소로 분리합니다.
 * 여러 독립 인스턴스가 테스트에서 공존할 수 있습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>thread-safe</li>
 *   <li>{@link #getOrCreate}는 원자적: 같은 키에 대해 factory는 최대 한 번 호출되고
 *       모든 호출자가 같은 인스턴스를 받아야 함</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface BucketStore {

    /**
     * 키의 버킷 조회, 없으면 생성.
     *
     * @param key 요청 키
     * @param factory 버킷 생성 함수
     * @return 키의 버킷 (항상 같은 인스턴스)
     * @throws IllegalArgumentException key 또는 factory가 null인 경우
     */
    TokenBucket getOrCreate(String key, Function<String, TokenBucket> factory);

    /**
     * 키의 버킷 조회.
     *
     * @param key 요청 키
     * @return 버킷 (없으면 empty)
     */
    Optional<TokenBucket> find(String key);

    /**
     * 키의 버킷 제거.
     *
     * @param key 요청 키
     * @return 제거된 경우 true
     */
    boolean remove(String key);

    /**
     * 저장된 버킷 수.
     *
     * @return 버킷 수
     */
    int size();

    /**
     * 모든 버킷 제거.
     */
    void clear();
}
