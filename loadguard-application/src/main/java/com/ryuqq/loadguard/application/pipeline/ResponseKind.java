package com.ryuqq.loadguard.application.pipeline;

/**
 * Pipeline 응답 종류.
 *
 * <p>각 종류는 HTTP 계층이 사용할 상태 코드를 함께 가집니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public enum ResponseKind {

    /** 토큰 부족으로 거절 (429 Too Many Requests). */
    REJECTED(429),

    /** 요청 경로에서 결과 산출 완료 (200 OK). */
    COMPLETED(200),

    /** 지연 작업으로 수락 (202 Accepted). */
    ACCEPTED(202);

    private final int httpStatus;

    ResponseKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    /**
     * 대응하는 HTTP 상태 코드.
     *
     * @return HTTP 상태 코드
     */
    public int httpStatus() {
        return httpStatus;
    }
}
