package com.ryuqq.loadguard.core.cache;

import com.ryuqq.loadguard.core.model.Fingerprint;

import java.util.function.Supplier;

/**
 * Result Cache SPI.
 *
 * <p>핸들러 결과를 Fingerprint 기준으로 TTL 동안 저장하며, 동일 Fingerprint에 대한
 * 동시 요청이 계산을 중복 수행하지 않도록 single-flight를 보장합니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>만료되지 않은 엔트리 존재 → 저장된 값 반환, compute 호출 안 함</li>
 *   <li>미스 또는 만료 → 정확히 한 호출자만 compute 실행, 나머지는 완료까지 대기</li>
 *   <li>compute 성공 → 모든 대기자가 같은 값을 받음, 엔트리 저장</li>
 *   <li>compute 실패 → 모든 대기자가 같은 예외 인스턴스를 받음, 저장 안 함 (다음 호출자가 재계산)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResultCache<UserDto> cache = ...;
 * Fingerprint fp = Fingerprint.derive("GET", "/users", userId);
 *
 * UserDto user = cache.getOrCompute(fp, () -> userRepository.slowLookup(userId));
 * }</pre>
 *
 * @param <V> 캐시 값 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface ResultCache<V> {

    /**
     * 캐시 조회 또는 계산.
     *
     * @param fingerprint 계산 입력 식별자
     * @param compute 미스 시 실행할 계산 (null 반환 불가)
     * @return 캐시된 값 또는 새로 계산된 값
     * @throws IllegalArgumentException fingerprint 또는 compute가 null인 경우
     * @throws IllegalStateException compute가 null을 반환했거나 대기 중 인터럽트된 경우
     * @throws RuntimeException compute가 던진 예외 (모든 대기자에게 동일 인스턴스 전달)
     */
    V getOrCompute(Fingerprint fingerprint, Supplier<V> compute);

    /**
     * 캐시 조회 또는 계산 (문자열 Fingerprint).
     *
     * @param fingerprint Fingerprint 값
     * @param compute 미스 시 실행할 계산
     * @return 캐시된 값 또는 새로 계산된 값
     * @see #getOrCompute(Fingerprint, Supplier)
     */
    default V getOrCompute(String fingerprint, Supplier<V> compute) {
        return getOrCompute(Fingerprint.of(fingerprint), compute);
    }

    /**
     * 엔트리 무효화.
     *
     * <p>진행 중인 계산에는 영향을 주지 않습니다.</p>
     *
     * @param fingerprint 무효화할 Fingerprint
     * @return 엔트리가 존재하여 제거된 경우 true
     */
    boolean invalidate(Fingerprint fingerprint);

    /**
     * 만료된 엔트리 일괄 제거.
     *
     * @return 제거된 엔트리 수
     */
    int evictExpired();

    /**
     * 저장된 엔트리 수 (만료되었지만 아직 제거되지 않은 엔트리 포함).
     *
     * @return 엔트리 수
     */
    int size();

    /**
     * 설정 정보 조회.
     *
     * @return 캐시 설정
     */
    CacheConfig getConfig();
}
