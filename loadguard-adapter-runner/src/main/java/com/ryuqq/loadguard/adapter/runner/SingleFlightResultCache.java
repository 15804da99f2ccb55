package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.core.cache.CacheConfig;
import com.ryuqq.loadguard.core.cache.CacheEntry;
import com.ryuqq.loadguard.core.cache.ResultCache;
import com.ryuqq.loadguard.core.clock.Clock;
import com.ryuqq.loadguard.core.model.Fingerprint;
import com.ryuqq.loadguard.core.spi.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.function.Supplier;

/**
 * Single-flight TTL Result Cache.
 *
 * <p>Fingerprint마다 명시적인 In-flight 마커를 두어, 동시에 들어온 미스 요청 중
 * 하나(leader)만 compute를 실행하고 나머지(waiter)는 그 결과를 기다립니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * getOrCompute(fp, compute)
 *   ↓
 * 1. CacheStore 조회 → 신선한 엔트리면 즉시 반환 (만료 엔트리는 조건부 제거)
 * 2. inFlight.putIfAbsent(fp, marker)
 *    - 기존 마커 있음 → latch 대기 → leader 결과 또는 같은 예외 인스턴스
 *    - 새 마커 등록 → leader
 * 3. leader: 다시 조회 (직전 leader가 막 저장했을 수 있음) → compute 실행
 * 4. 성공: CacheStore 저장 → 마커 제거 → latch 해제
 *    실패: 저장 없이 마커 제거 → latch 해제 → 같은 예외를 모든 대기자에게 전달
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>같은 Fingerprint에 대해 동시에 실행되는 compute는 최대 1개</li>
 *   <li>서로 다른 Fingerprint는 서로를 차단하지 않음</li>
 *   <li>실패 결과는 캐시되지 않음 (다음 호출자가 재계산)</li>
 * </ul>
 *
 * @param <V> 캐시 값 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class SingleFlightResultCache<V> implements ResultCache<V> {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightResultCache.class);

    private final CacheStore<V> cacheStore;
    private final Clock clock;
    private final CacheConfig config;
    private final ConcurrentHashMap<Fingerprint, InFlight<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param cacheStore 엔트리 저장소
     * @param clock 시간 소스
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SingleFlightResultCache(CacheStore<V> cacheStore, Clock clock, CacheConfig config) {
        if (cacheStore == null) {
            throw new IllegalArgumentException("cacheStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cacheStore = cacheStore;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public V getOrCompute(Fingerprint fingerprint, Supplier<V> compute) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (compute == null) {
            throw new IllegalArgumentException("compute cannot be null");
        }

        Optional<V> fresh = lookupFresh(fingerprint);
        if (fresh.isPresent()) {
            return fresh.get();
        }

        InFlight<V> marker = new InFlight<>();
        InFlight<V> existing = inFlight.putIfAbsent(fingerprint, marker);
        if (existing != null) {
            return existing.await(fingerprint);
        }
        return lead(fingerprint, compute, marker);
    }

    @Override
    public boolean invalidate(Fingerprint fingerprint) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        return cacheStore.remove(fingerprint);
    }

    @Override
    public int evictExpired() {
        return cacheStore.removeExpired(clock.nowNanos());
    }

    @Override
    public int size() {
        return cacheStore.size();
    }

    @Override
    public CacheConfig getConfig() {
        return config;
    }

    /**
     * 현재 진행 중인 compute 수.
     *
     * @return In-flight 마커 수
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private V lead(Fingerprint fingerprint, Supplier<V> compute, InFlight<V> marker) {
        try {
            // 직전 leader가 마커를 지우기 전에 저장을 마쳤을 수 있음
            Optional<V> fresh = lookupFresh(fingerprint);
            if (fresh.isPresent()) {
                marker.succeed(fresh.get());
                return fresh.get();
            }

            V value = compute.get();
            if (value == null) {
                throw new IllegalStateException("compute returned null for fingerprint: " + fingerprint);
            }
            cacheStore.put(fingerprint, new CacheEntry<>(value, clock.nowNanos() + config.ttlNanos()));
            marker.succeed(value);
            return value;

        } catch (Throwable e) {
            log.warn("Compute failed for {}: {}", fingerprint, e.toString());
            marker.fail(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, marker);
            marker.release();
        }
    }

    private Optional<V> lookupFresh(Fingerprint fingerprint) {
        Optional<CacheEntry<V>> entry = cacheStore.get(fingerprint);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry<V> found = entry.get();
        if (found.isExpired(clock.nowNanos())) {
            cacheStore.removeIfSame(fingerprint, found);
            return Optional.empty();
        }
        return Optional.of(found.value());
    }

    /**
     * Fingerprint 하나에 대한 진행 중 계산.
     *
     * <p>value/failure는 latch 해제 전에 기록되므로 countDown/await의 happens-before로 가시성이 보장됩니다.</p>
     */
    private static final class InFlight<V> {

        private final CountDownLatch latch = new CountDownLatch(1);
        private V value;
        private Throwable failure;

        void succeed(V value) {
            this.value = value;
        }

        void fail(Throwable failure) {
            this.failure = failure;
        }

        void release() {
            latch.countDown();
        }

        V await(Fingerprint fingerprint) {
            try {
                latch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for in-flight compute: " + fingerprint, e);
            }
            if (failure instanceof RuntimeException) {
                throw (RuntimeException) failure;
            }
            if (failure instanceof Error) {
                throw (Error) failure;
            }
            if (failure != null) {
                throw new IllegalStateException("In-flight compute failed for " + fingerprint, failure);
            }
            return value;
        }
    }
}
