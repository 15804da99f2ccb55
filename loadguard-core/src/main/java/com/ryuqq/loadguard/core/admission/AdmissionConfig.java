package com.ryuqq.loadguard.core.admission;

import java.util.concurrent.TimeUnit;

/**
 * Admission Controller 설정.
 *
 * <p>Token Bucket의 용량과 리필 속도를 정의합니다.
 * refillIntervalMs마다 refillTokens개의 토큰이 연속적으로(비례 배분) 채워지며,
 * capacity를 초과하지 않습니다.</p>
 *
 * <p><strong>예시:</strong> capacity=10, refillTokens=5, refillIntervalMs=1000 이면
 * 최대 10건 버스트 후 초당 5건의 평균 처리율을 허용합니다.</p>
 *
 * @param capacity 버킷 최대 토큰 수 (양수)
 * @param refillTokens 리필 주기당 보충 토큰 수 (양수)
 * @param refillIntervalMs 리필 주기 (밀리초, 양수)
 * @author LoadGuard Team
 * @since 1.0.0
 */
public record AdmissionConfig(long capacity, long refillTokens, long refillIntervalMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: capacity=100, refillTokens=100, refillIntervalMs=1000ms</p>
     */
    public AdmissionConfig() {
        this(100, 100, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public AdmissionConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (refillTokens <= 0) {
            throw new IllegalArgumentException("refillTokens must be positive (current: " + refillTokens + ")");
        }
        if (refillIntervalMs <= 0) {
            throw new IllegalArgumentException("refillIntervalMs must be positive (current: " + refillIntervalMs + ")");
        }
    }

    /**
     * 리필 주기 (나노초).
     *
     * @return refillIntervalMs를 나노초로 환산한 값
     */
    public long refillIntervalNanos() {
        return TimeUnit.MILLISECONDS.toNanos(refillIntervalMs);
    }

    /**
     * capacity만 변경한 새 인스턴스 생성.
     */
    public AdmissionConfig withCapacity(long capacity) {
        return new AdmissionConfig(capacity, refillTokens, refillIntervalMs);
    }

    /**
     * refillTokens만 변경한 새 인스턴스 생성.
     */
    public AdmissionConfig withRefillTokens(long refillTokens) {
        return new AdmissionConfig(capacity, refillTokens, refillIntervalMs);
    }

    /**
     * refillIntervalMs만 변경한 새 인스턴스 생성.
     */
    public AdmissionConfig withRefillIntervalMs(long refillIntervalMs) {
        return new AdmissionConfig(capacity, refillTokens, refillIntervalMs);
    }
}
