package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.adapter.inmemory.store.InMemoryBucketStore;
import com.ryuqq.loadguard.core.admission.AdmissionConfig;
import com.ryuqq.loadguard.core.admission.AdmissionDecision;
import com.ryuqq.loadguard.core.clock.ManualClock;
import com.ryuqq.loadguard.core.spi.BucketStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TokenBucketAdmissionController 유닛 테스트.
 *
 * <p>ManualClock으로 시간을 고정하여 리필 동작을 결정적으로 검증합니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
class TokenBucketAdmissionControllerTest {

    private ManualClock clock;
    private BucketStore bucketStore;
    private TokenBucketAdmissionController controller;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000_000L);
        bucketStore = new InMemoryBucketStore();
        controller = new TokenBucketAdmissionController(bucketStore, clock, new AdmissionConfig(3, 2, 1000));
    }

    @Test
    void 시간_경과_없이_capacity만큼만_허용() {
        // when & then
        assertThat(controller.allow("client-1")).isTrue();
        assertThat(controller.allow("client-1")).isTrue();
        assertThat(controller.allow("client-1")).isTrue();
        assertThat(controller.allow("client-1")).isFalse();
        assertThat(controller.allow("client-1")).isFalse();
    }

    @Test
    void 리필_주기_후_refillTokens만큼_추가_허용() {
        // given
        drain("client-1");

        // when
        clock.advance(1000, TimeUnit.MILLISECONDS);

        // then
        assertThat(controller.allow("client-1")).isTrue();
        assertThat(controller.allow("client-1")).isTrue();
        assertThat(controller.allow("client-1")).isFalse();
    }

    @Test
    void 대기_중_재시도가_섞여도_한_주기_동안_정확히_refillTokens만큼_허용() {
        // given
        drain("client-1");
        int allowed = 0;

        // when
        for (int step = 0; step < 10; step++) {
            clock.advance(100, TimeUnit.MILLISECONDS);
            if (controller.allow("client-1")) {
                allowed++;
            }
        }

        // then
        assertThat(allowed).isEqualTo(2);
        assertThat(controller.allow("client-1")).isFalse();
    }

    @Test
    void refillTokens_3에서_100ms_단위_재시도_후_주기_경계에서도_허용() {
        // given
        TokenBucketAdmissionController triple =
            new TokenBucketAdmissionController(new InMemoryBucketStore(), clock, new AdmissionConfig(3, 3, 1000));
        while (triple.allow("client-1")) {
            // 토큰 소진
        }
        List<Integer> allowedAtMs = new ArrayList<>();

        // when
        for (int step = 1; step <= 10; step++) {
            clock.advance(100, TimeUnit.MILLISECONDS);
            if (triple.allow("client-1")) {
                allowedAtMs.add(step * 100);
            }
        }

        // then
        assertThat(allowedAtMs).containsExactly(400, 700, 1000);
        assertThat(triple.allow("client-1")).isFalse();
    }

    @Test
    void 긴_시간이_지나도_capacity를_넘지_않음() {
        // given
        drain("client-1");

        // when
        clock.advance(1, TimeUnit.HOURS);

        // then
        int allowed = 0;
        while (controller.allow("client-1")) {
            allowed++;
        }
        assertThat(allowed).isEqualTo(3);
    }

    @Test
    void 거절_시_retryAfter는_토큰_하나가_찰_때까지의_시간() {
        // given
        drain("client-1");

        // when
        AdmissionDecision decision = controller.evaluate("client-1");

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfterNanos()).isEqualTo(TimeUnit.MILLISECONDS.toNanos(500));
        assertThat(decision.retryAfterMillis()).isEqualTo(500);
    }

    @Test
    void 키마다_독립된_버킷() {
        // given
        drain("client-1");

        // when & then
        assertThat(controller.allow("client-1")).isFalse();
        assertThat(controller.allow("client-2")).isTrue();
        assertThat(bucketStore.size()).isEqualTo(2);
    }

    @Test
    void 동시_요청에도_capacity를_초과하여_허용하지_않음() throws Exception {
        // given
        TokenBucketAdmissionController wide =
            new TokenBucketAdmissionController(new InMemoryBucketStore(), clock, new AdmissionConfig(50, 1, 1000));
        int threads = 20;
        int callsPerThread = 10;
        AtomicInteger allowed = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                for (int j = 0; j < callsPerThread; j++) {
                    if (wide.allow("shared-key")) {
                        allowed.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        assertThat(allowed.get()).isEqualTo(50);
    }

    @Test
    void blank_키는_예외() {
        assertThatThrownBy(() -> controller.allow(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key cannot be null or blank");
    }

    @Test
    void 생성자_null_의존성_예외() {
        assertThatThrownBy(() -> new TokenBucketAdmissionController(null, clock, new AdmissionConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bucketStore cannot be null");
    }

    private void drain(String key) {
        while (controller.allow(key)) {
            // 소진
        }
    }
}
