package com.ryuqq.loadguard.core.admission;

import java.util.concurrent.TimeUnit;

/**
 * Admission 결정 결과.
 *
 * @param allowed 허용 여부
 * @param retryAfterNanos 거부 시 다음 토큰까지 예상 대기 시간 (허용 시 0)
 * @author LoadGuard Team
 * @since 1.0.0
 */
public record AdmissionDecision(boolean allowed, long retryAfterNanos) {

    private static final AdmissionDecision ALLOWED = new AdmissionDecision(true, 0L);

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException retryAfterNanos가 음수이거나, 허용인데 0이 아닌 경우
     */
    public AdmissionDecision {
        if (retryAfterNanos < 0) {
            throw new IllegalArgumentException("retryAfterNanos cannot be negative (current: " + retryAfterNanos + ")");
        }
        if (allowed && retryAfterNanos != 0) {
            throw new IllegalArgumentException("retryAfterNanos must be 0 when allowed");
        }
    }

    /**
     * 허용 결정.
     *
     * @return 허용 결정 (공유 인스턴스)
     */
    public static AdmissionDecision allow() {
        return ALLOWED;
    }

    /**
     * 거부 결정.
     *
     * @param retryAfterNanos 재시도 권장 대기 시간 (나노초)
     * @return 거부 결정
     */
    public static AdmissionDecision reject(long retryAfterNanos) {
        return new AdmissionDecision(false, Math.max(0L, retryAfterNanos));
    }

    /**
     * 재시도 권장 대기 시간 (밀리초, 올림).
     *
     * @return 밀리초 단위 대기 시간
     */
    public long retryAfterMillis() {
        long millis = TimeUnit.NANOSECONDS.toMillis(retryAfterNanos);
        return TimeUnit.MILLISECONDS.toNanos(millis) < retryAfterNanos ? millis + 1 : millis;
    }
}
