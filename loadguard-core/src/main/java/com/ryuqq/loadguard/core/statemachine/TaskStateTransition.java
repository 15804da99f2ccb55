package com.ryuqq.loadguard.core.statemachine;

/**
 * Task 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → FAILED (시작 전 취소 또는 실행기 종료)</li>
 *   <li>RUNNING → SUCCEEDED</li>
 *   <li>RUNNING → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가, 역방향 전이 불가</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class TaskStateTransition {

    private TaskStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 허용되는지 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(TaskState from, TaskState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case PENDING -> to == TaskState.RUNNING || to == TaskState.FAILED;
            case RUNNING -> to == TaskState.SUCCEEDED || to == TaskState.FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TaskState from, TaskState to) {
        if (isAllowed(from, to)) {
            return;
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        throw new IllegalStateException(
            String.format("Invalid state transition: %s → %s", from, to)
        );
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TaskState transition(TaskState current, TaskState next) {
        validate(current, next);
        return next;
    }
}
