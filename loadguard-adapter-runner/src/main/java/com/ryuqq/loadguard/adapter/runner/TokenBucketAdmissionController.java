package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.core.admission.AdmissionConfig;
import com.ryuqq.loadguard.core.admission.AdmissionController;
import com.ryuqq.loadguard.core.admission.AdmissionDecision;
import com.ryuqq.loadguard.core.admission.TokenBucket;
import com.ryuqq.loadguard.core.clock.Clock;
import com.ryuqq.loadguard.core.spi.BucketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token Bucket 기반 Admission Controller.
 *
 * <p>키마다 하나의 {@link TokenBucket}을 {@link BucketStore}에서 지연 생성하여 사용합니다.
 * 새 키는 가득 찬 버킷으로 시작합니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>버킷 생성은 BucketStore가 키당 한 번만 수행</li>
 *   <li>리필과 소비는 각 버킷의 모니터 안에서 원자적으로 수행</li>
 *   <li>서로 다른 키는 서로를 차단하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AdmissionController controller = new TokenBucketAdmissionController(
 *     new InMemoryBucketStore(), SystemClock.instance(), new AdmissionConfig(10, 5, 1000));
 *
 * if (!controller.allow(apiKey)) {
 *     // 429 Too Many Requests
 * }
 * </pre>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class TokenBucketAdmissionController implements AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketAdmissionController.class);

    private final BucketStore bucketStore;
    private final Clock clock;
    private final AdmissionConfig config;

    /**
     * 생성자.
     *
     * @param bucketStore 버킷 저장소
     * @param clock 시간 소스
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TokenBucketAdmissionController(BucketStore bucketStore, Clock clock, AdmissionConfig config) {
        if (bucketStore == null) {
            throw new IllegalArgumentException("bucketStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.bucketStore = bucketStore;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public AdmissionDecision evaluate(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }

        TokenBucket bucket = bucketStore.getOrCreate(key, k -> new TokenBucket(clock, config));
        AdmissionDecision decision = bucket.tryConsume();

        if (!decision.allowed()) {
            log.debug("Admission rejected for key {}: retry after {}ms", key, decision.retryAfterMillis());
        }
        return decision;
    }

    @Override
    public AdmissionConfig getConfig() {
        return config;
    }
}
