package com.ryuqq.loadguard.core.clock;

/**
 * 시간 소스 추상화.
 *
 * <p>토큰 리필, 캐시 만료, 작업 타임스탬프 계산에 사용됩니다.
 * 테스트에서는 {@link ManualClock}으로 교체하여 시간 흐름을 결정적으로 제어합니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface Clock {

    /**
     * 단조 증가 시각 (나노초).
     *
     * <p>경과 시간 계산에만 사용해야 하며, 벽시계 시각과는 무관합니다.</p>
     *
     * @return 현재 나노초 값
     */
    long nowNanos();

    /**
     * 벽시계 시각 (epoch 밀리초).
     *
     * @return 현재 epoch 밀리초
     */
    long nowMillis();
}
