package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.adapter.inmemory.store.InMemoryCacheStore;
import com.ryuqq.loadguard.core.cache.CacheConfig;
import com.ryuqq.loadguard.core.clock.ManualClock;
import com.ryuqq.loadguard.core.model.Fingerprint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SingleFlightResultCache 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>TTL 내 적중, TTL 경과 후 재계산</li>
 *   <li>동시 미스에서 compute 정확히 1회</li>
 *   <li>실패 전파 (같은 예외 인스턴스, 캐시하지 않음)</li>
 *   <li>대기 중 인터럽트</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
class SingleFlightResultCacheTest {

    private static final Fingerprint FP = Fingerprint.of("GET:/api/products");

    private ManualClock clock;
    private InMemoryCacheStore<String> store;
    private SingleFlightResultCache<String> cache;
    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        store = new InMemoryCacheStore<>();
        cache = new SingleFlightResultCache<>(store, clock, new CacheConfig(1000));
        executorService = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void TTL_내에서는_compute를_다시_호출하지_않음() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        String first = cache.getOrCompute(FP, () -> "v" + calls.incrementAndGet());
        clock.advanceNanos(TimeUnit.MILLISECONDS.toNanos(1000) - 1);
        String second = cache.getOrCompute(FP, () -> "v" + calls.incrementAndGet());

        // then
        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void TTL_경과_후_재계산() {
        // given
        AtomicInteger calls = new AtomicInteger();
        cache.getOrCompute(FP, () -> "v" + calls.incrementAndGet());

        // when
        clock.advance(1000, TimeUnit.MILLISECONDS);
        String recomputed = cache.getOrCompute(FP, () -> "v" + calls.incrementAndGet());

        // then
        assertThat(recomputed).isEqualTo("v2");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void 동시_미스에서도_compute는_한번만_실행되고_모두_같은_값() throws Exception {
        // given
        int callers = 16;
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch computeStarted = new CountDownLatch(1);
        CountDownLatch releaseCompute = new CountDownLatch(1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < callers; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                return cache.getOrCompute(FP, () -> {
                    calls.incrementAndGet();
                    computeStarted.countDown();
                    awaitQuietly(releaseCompute);
                    return "shared-value";
                });
            }));
        }
        start.countDown();
        assertThat(computeStarted.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        releaseCompute.countDown();

        // then
        for (Future<String> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo("shared-value");
        }
        assertThat(calls.get()).isEqualTo(1);
        assertThat(cache.inFlightCount()).isZero();
    }

    @Test
    void compute_실패는_모든_호출자에게_같은_예외_인스턴스로_전달되고_캐시되지_않음() throws Exception {
        // given
        IllegalStateException boom = new IllegalStateException("backend down");
        int callers = 8;
        CountDownLatch computeStarted = new CountDownLatch(1);
        CountDownLatch releaseCompute = new CountDownLatch(1);
        List<Future<Throwable>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < callers; i++) {
            futures.add(executorService.submit(() -> {
                try {
                    cache.getOrCompute(FP, () -> {
                        computeStarted.countDown();
                        awaitQuietly(releaseCompute);
                        throw boom;
                    });
                    return null;
                } catch (RuntimeException e) {
                    return e;
                }
            }));
        }
        assertThat(computeStarted.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        releaseCompute.countDown();

        // then
        for (Future<Throwable> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(boom);
        }
        assertThat(cache.size()).isZero();
    }

    @Test
    void 실패_후_다음_호출자는_재계산() {
        // given
        assertThatThrownBy(() -> cache.getOrCompute(FP, () -> {
            throw new IllegalArgumentException("first attempt");
        })).isInstanceOf(IllegalArgumentException.class);

        // when
        String value = cache.getOrCompute(FP, () -> "second attempt");

        // then
        assertThat(value).isEqualTo("second attempt");
    }

    @Test
    void compute가_null을_반환하면_IllegalStateException() {
        assertThatThrownBy(() -> cache.getOrCompute(FP, () -> null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("compute returned null");
        assertThat(cache.size()).isZero();
    }

    @Test
    void 다른_fingerprint는_서로를_차단하지_않음() throws Exception {
        // given
        CountDownLatch computeStarted = new CountDownLatch(1);
        CountDownLatch releaseCompute = new CountDownLatch(1);
        Future<String> slow = executorService.submit(() -> cache.getOrCompute(FP, () -> {
            computeStarted.countDown();
            awaitQuietly(releaseCompute);
            return "slow";
        }));
        assertThat(computeStarted.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        Future<String> fast = executorService.submit(
            () -> cache.getOrCompute(Fingerprint.of("GET:/api/other"), () -> "fast"));

        // then
        assertThat(fast.get(2, TimeUnit.SECONDS)).isEqualTo("fast");
        assertThat(slow.isDone()).isFalse();

        releaseCompute.countDown();
        assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
    }

    @Test
    void 대기_중_인터럽트되면_플래그를_복원하고_IllegalStateException() throws Exception {
        // given
        CountDownLatch computeStarted = new CountDownLatch(1);
        CountDownLatch releaseCompute = new CountDownLatch(1);
        Future<String> leader = executorService.submit(() -> cache.getOrCompute(FP, () -> {
            computeStarted.countDown();
            awaitQuietly(releaseCompute);
            return "leader-value";
        }));
        assertThat(computeStarted.await(5, TimeUnit.SECONDS)).isTrue();

        AtomicReference<Throwable> caught = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                cache.getOrCompute(FP, () -> "never");
            } catch (RuntimeException e) {
                caught.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });

        // when
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(5000);

        // then
        assertThat(caught.get()).isInstanceOf(IllegalStateException.class);
        assertThat(interruptFlag.get()).isTrue();

        releaseCompute.countDown();
        assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo("leader-value");
    }

    @Test
    void evictExpired는_만료된_엔트리만_제거() {
        // given
        cache.getOrCompute(Fingerprint.of("a"), () -> "a");
        cache.getOrCompute(Fingerprint.of("b"), () -> "b");
        clock.advance(1000, TimeUnit.MILLISECONDS);
        cache.getOrCompute(Fingerprint.of("c"), () -> "c");

        // when
        int evicted = cache.evictExpired();

        // then
        assertThat(evicted).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void invalidate_후_재계산() {
        // given
        cache.getOrCompute(FP, () -> "old");

        // when
        boolean removed = cache.invalidate(FP);

        // then
        assertThat(removed).isTrue();
        assertThat(cache.getOrCompute(FP, () -> "new")).isEqualTo("new");
    }

    @Test
    void 문자열_fingerprint_오버로드() {
        // when
        String value = cache.getOrCompute("GET:/api/products", () -> "value");

        // then
        assertThat(cache.getOrCompute(FP, () -> "other")).isEqualTo(value);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
