package com.ryuqq.loadguard.core.admission;

import com.ryuqq.loadguard.core.clock.Clock;

/**
 * 키 하나에 대응하는 Token Bucket.
 *
 * <p><strong>알고리즘 (greedy refill, 정수 credit):</strong></p>
 * <pre>
 * 토큰 1개 = refillInterval(ns) credit
 * elapsed = now - lastRefill          (음수면 0, lastRefill은 역행하지 않음)
 * credit  = min(capacity * refillInterval, credit + elapsed * refillTokens)
 * credit >= refillInterval → credit -= refillInterval, 허용
 * credit <  refillInterval → 거부 (리필 외 상태 변경 없음)
 * </pre>
 *
 * <p>credit은 long 정수이므로 리필 구간을 몇 번에 나눠 반영하든 누적 결과가 같습니다.
 * 한 주기가 지나면 정확히 refillTokens개가 보충됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>0 &lt;= tokens &lt;= capacity</li>
 *   <li>새 버킷은 가득 찬 상태로 시작</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 인스턴스 자체가 키별 잠금 역할을 합니다 (synchronized).
 * 임계 구역은 O(1)입니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class TokenBucket {

    private final Clock clock;
    private final long capacity;
    private final long refillTokens;
    private final long creditPerToken;
    private final long maxCredit;

    private long credit;
    private long lastRefillNanos;

    /**
     * 생성자 (가득 찬 버킷).
     *
     * @param clock 시간 소스
     * @param config 용량 및 리필 설정
     * @throws IllegalArgumentException clock 또는 config가 null인 경우
     */
    public TokenBucket(Clock clock, AdmissionConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.clock = clock;
        this.capacity = config.capacity();
        this.refillTokens = config.refillTokens();
        this.creditPerToken = config.refillIntervalNanos();
        this.maxCredit = saturatedMultiply(capacity, creditPerToken);
        this.credit = maxCredit;
        this.lastRefillNanos = clock.nowNanos();
    }

    /**
     * 토큰 1개 소비 시도.
     *
     * @return 허용 또는 거부(재시도 힌트 포함)
     */
    public synchronized AdmissionDecision tryConsume() {
        refill();

        if (credit >= creditPerToken) {
            credit -= creditPerToken;
            return AdmissionDecision.allow();
        }

        long retryAfter = ceilDiv(creditPerToken - credit, refillTokens);
        return AdmissionDecision.reject(retryAfter);
    }

    /**
     * 현재 사용 가능한 토큰 수 (리필 반영).
     *
     * @return 토큰 수 (소수점 포함)
     */
    public synchronized double availableTokens() {
        refill();
        return tokens();
    }

    /**
     * 마지막 리필 시각.
     *
     * @return 나노초
     */
    public synchronized long lastRefillNanos() {
        return lastRefillNanos;
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }

        // elapsed가 남은 공간을 채우는 시간보다 짧으면 elapsed * refillTokens < room 이므로 overflow 없음
        long room = maxCredit - credit;
        if (elapsed >= ceilDiv(room, refillTokens)) {
            credit = maxCredit;
        } else {
            credit += elapsed * refillTokens;
        }
        lastRefillNanos = now;
    }

    private double tokens() {
        return (double) credit / creditPerToken;
    }

    private static long ceilDiv(long dividend, long divisor) {
        long quotient = dividend / divisor;
        return dividend % divisor == 0 ? quotient : quotient + 1;
    }

    private static long saturatedMultiply(long a, long b) {
        if (a > Long.MAX_VALUE / b) {
            return Long.MAX_VALUE;
        }
        return a * b;
    }

    @Override
    public synchronized String toString() {
        return "TokenBucket{tokens=" + tokens() + ", capacity=" + capacity + ", lastRefillNanos=" + lastRefillNanos + "}";
    }
}
