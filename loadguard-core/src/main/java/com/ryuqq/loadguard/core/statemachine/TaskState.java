package com.ryuqq.loadguard.core.statemachine;

/**
 * Deferred Task의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──(취소/종료)──┐
 *    │                  │
 *    ▼ (워커 시작)        │
 * RUNNING               │
 *    │                  │
 *    ├─► SUCCEEDED      │
 *    │                  │
 *    └─► FAILED ◄───────┘
 *
 * 금지된 전이:
 * - SUCCEEDED → * ❌
 * - FAILED → * ❌
 * - RUNNING → PENDING ❌
 * - PENDING → SUCCEEDED ❌ (실행 없이 성공 불가)
 * </pre>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public enum TaskState {

    /**
     * 대기 중 (큐에 있음, 아직 실행 시작 안 됨).
     */
    PENDING,

    /**
     * 워커에서 실행 중.
     */
    RUNNING,

    /**
     * 성공 완료.
     */
    SUCCEEDED,

    /**
     * 실패 (작업 예외, 취소, 또는 실행기 종료).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
