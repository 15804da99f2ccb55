package com.ryuqq.loadguard.core.clock;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 수동 제어 시계.
 *
 * <p>테스트에서 토큰 리필 주기나 캐시 TTL 경과를 sleep 없이 재현하기 위해 사용합니다.
 * 여러 스레드에서 읽어도 안전합니다.</p>
 *
 * <pre>{@code
 * ManualClock clock = new ManualClock(0L);
 * clock.advance(1, TimeUnit.SECONDS);
 * }</pre>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class ManualClock implements Clock {

    private final AtomicLong nanos;
    private final long epochMillisAtZero;

    /**
     * 생성자.
     *
     * @param startNanos 시작 나노초
     */
    public ManualClock(long startNanos) {
        this(startNanos, 0L);
    }

    /**
     * 생성자 (벽시계 기준점 지정).
     *
     * @param startNanos 시작 나노초
     * @param epochMillisAtZero 나노초 0에 대응하는 epoch 밀리초
     */
    public ManualClock(long startNanos, long epochMillisAtZero) {
        this.nanos = new AtomicLong(startNanos);
        this.epochMillisAtZero = epochMillisAtZero;
    }

    @Override
    public long nowNanos() {
        return nanos.get();
    }

    @Override
    public long nowMillis() {
        return epochMillisAtZero + TimeUnit.NANOSECONDS.toMillis(nanos.get());
    }

    /**
     * 시계를 앞으로 진행.
     *
     * @param deltaNanos 진행할 나노초
     * @throws IllegalArgumentException deltaNanos가 음수인 경우
     */
    public void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("deltaNanos cannot be negative (current: " + deltaNanos + ")");
        }
        nanos.addAndGet(deltaNanos);
    }

    /**
     * 시계를 앞으로 진행.
     *
     * @param amount 진행량
     * @param unit 단위
     * @throws IllegalArgumentException amount가 음수인 경우
     */
    public void advance(long amount, TimeUnit unit) {
        advanceNanos(unit.toNanos(amount));
    }

    /**
     * 시계를 특정 시각으로 설정 (역행 시나리오 재현용).
     *
     * @param value 설정할 나노초
     */
    public void setNanos(long value) {
        nanos.set(value);
    }
}
