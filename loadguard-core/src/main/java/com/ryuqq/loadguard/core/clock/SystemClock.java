package com.ryuqq.loadguard.core.clock;

/**
 * 시스템 시계 구현.
 *
 * <p>{@link System#nanoTime()}과 {@link System#currentTimeMillis()}를 그대로 사용합니다.
 * 프로덕션 환경 또는 결정성이 필요 없는 동시성 테스트에서 사용합니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class SystemClock implements Clock {

    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    /**
     * 공유 인스턴스 조회.
     *
     * @return SystemClock (상태 없음)
     */
    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}
