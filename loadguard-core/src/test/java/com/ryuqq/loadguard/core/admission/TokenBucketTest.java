package com.ryuqq.loadguard.core.admission;

import com.ryuqq.loadguard.core.clock.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenBucket 유닛 테스트.
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
@DisplayName("TokenBucket 테스트")
class TokenBucketTest {

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000_000L);
    }

    @Test
    @DisplayName("경과 시간이 0이면 capacity 만큼만 허용하고 다음 요청은 거부한다")
    void 경과시간_0이면_capacity만큼_허용() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(5, 1, 1000));

        // when & then
        for (int i = 0; i < 5; i++) {
            assertTrue(bucket.tryConsume().allowed(), "request " + i + " should be allowed");
        }
        assertFalse(bucket.tryConsume().allowed());
    }

    @Test
    @DisplayName("리필 주기 하나가 지나면 정확히 refillTokens 개가 추가된다")
    void 리필_주기_경과_시_refillTokens_추가() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(5, 2, 1000));
        drain(bucket);

        // when
        clock.advance(1000, TimeUnit.MILLISECONDS);

        // then
        assertTrue(bucket.tryConsume().allowed());
        assertTrue(bucket.tryConsume().allowed());
        assertFalse(bucket.tryConsume().allowed());
    }

    @Test
    @DisplayName("리필 주기를 100ms씩 나눠 거부 요청을 섞어도 주기 경계에서 토큰 1개가 정확히 채워진다")
    void 나눠진_리필도_주기_경계에서_정확히_1개() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(1, 1, 1000));
        assertTrue(bucket.tryConsume().allowed());

        // when
        for (int step = 1; step < 10; step++) {
            clock.advance(100, TimeUnit.MILLISECONDS);
            assertFalse(bucket.tryConsume().allowed(), "step " + step + " should be rejected");
        }
        clock.advance(100, TimeUnit.MILLISECONDS);

        // then
        assertEquals(1.0d, bucket.availableTokens(), 0.0d);
        assertTrue(bucket.tryConsume().allowed());
        assertFalse(bucket.tryConsume().allowed());
    }

    @Test
    @DisplayName("333/333/334ms로 나눠진 리필 주기 후 정확히 refillTokens 개가 허용된다")
    void 불균등_분할_리필도_정확히_refillTokens() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(3, 3, 1000));
        drain(bucket);

        // when
        clock.advance(333, TimeUnit.MILLISECONDS);
        bucket.availableTokens();
        clock.advance(333, TimeUnit.MILLISECONDS);
        bucket.availableTokens();
        clock.advance(334, TimeUnit.MILLISECONDS);

        // then
        assertTrue(bucket.tryConsume().allowed());
        assertTrue(bucket.tryConsume().allowed());
        assertTrue(bucket.tryConsume().allowed());
        assertFalse(bucket.tryConsume().allowed());
    }

    @Test
    @DisplayName("거부 직후의 retryAfter만큼 기다리면 다음 요청이 허용된다")
    void retryAfter만큼_대기_후_허용() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(1, 3, 1000));
        bucket.tryConsume();
        clock.advance(100, TimeUnit.MILLISECONDS);

        // when
        AdmissionDecision decision = bucket.tryConsume();
        clock.advance(decision.retryAfterNanos(), TimeUnit.NANOSECONDS);

        // then
        assertFalse(decision.allowed());
        assertTrue(bucket.tryConsume().allowed());
    }

    @Test
    @DisplayName("무제한에 가까운 설정에서도 credit이 overflow 되지 않는다")
    void 큰_설정값에서도_overflow_없음() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(Long.MAX_VALUE, Long.MAX_VALUE, 1));
        bucket.tryConsume();

        // when
        clock.advance(1, TimeUnit.HOURS);

        // then
        assertTrue(bucket.tryConsume().allowed());
        assertTrue(bucket.availableTokens() > 0.0d);
    }

    @Test
    @DisplayName("리필은 capacity를 넘지 않는다")
    void 리필은_capacity_초과_안함() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(3, 2, 1000));
        drain(bucket);

        // when
        clock.advance(10, TimeUnit.SECONDS);

        // then
        assertEquals(3.0d, bucket.availableTokens(), 0.0d);
    }

    @Test
    @DisplayName("리필은 경과 시간에 비례해 연속적으로 누적된다")
    void 리필은_비례_누적() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(10, 4, 1000));
        drain(bucket);

        // when
        clock.advance(250, TimeUnit.MILLISECONDS);

        // then
        assertEquals(1.0d, bucket.availableTokens(), 1e-9);
        assertTrue(bucket.tryConsume().allowed());
        assertFalse(bucket.tryConsume().allowed());
    }

    @Test
    @DisplayName("거부 시 다음 토큰까지의 대기 시간을 반환한다")
    void 거부_시_retryAfter_반환() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(1, 1, 1000));
        bucket.tryConsume();

        // when
        AdmissionDecision decision = bucket.tryConsume();

        // then
        assertFalse(decision.allowed());
        assertEquals(TimeUnit.SECONDS.toNanos(1), decision.retryAfterNanos());
        assertEquals(1000L, decision.retryAfterMillis());
    }

    @Test
    @DisplayName("거부는 리필 외에 토큰을 변경하지 않는다")
    void 거부는_토큰_변경_없음() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(2, 1, 1000));
        drain(bucket);
        clock.advance(500, TimeUnit.MILLISECONDS);

        // when
        bucket.tryConsume();
        bucket.tryConsume();

        // then
        assertEquals(0.5d, bucket.availableTokens(), 1e-9);
    }

    @Test
    @DisplayName("시계가 역행해도 토큰이 줄거나 lastRefill이 되돌아가지 않는다")
    void 시계_역행_시_리필_없음() {
        // given
        TokenBucket bucket = new TokenBucket(clock, new AdmissionConfig(2, 1, 1000));
        long before = bucket.lastRefillNanos();
        bucket.tryConsume();

        // when
        clock.setNanos(0L);

        // then
        assertEquals(1.0d, bucket.availableTokens(), 0.0d);
        assertEquals(before, bucket.lastRefillNanos());
    }

    @Test
    @DisplayName("clock 또는 config가 null이면 예외가 발생한다")
    void null_인자_예외() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(null, new AdmissionConfig()));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(clock, null));
    }

    private void drain(TokenBucket bucket) {
        while (bucket.tryConsume().allowed()) {
            // 토큰 소진
        }
    }
}
