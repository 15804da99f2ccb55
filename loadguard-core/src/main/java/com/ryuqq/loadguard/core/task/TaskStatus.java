package com.ryuqq.loadguard.core.task;

import com.ryuqq.loadguard.core.model.TaskHandle;
import com.ryuqq.loadguard.core.statemachine.TaskState;
import com.ryuqq.loadguard.core.statemachine.TaskStateTransition;

/**
 * Deferred Task 상태 스냅샷 (불변).
 *
 * <p><strong>필드 규칙:</strong></p>
 * <ul>
 *   <li>SUCCEEDED: result 사용 가능 (작업이 null을 반환했다면 null), failure는 null</li>
 *   <li>FAILED: failure non-null, result는 null</li>
 *   <li>PENDING / RUNNING: result, failure 모두 null</li>
 *   <li>startedAtMillis: RUNNING 이후에만 0보다 큼 (시작 전 취소 시 0)</li>
 *   <li>finishedAtMillis: 종료 상태에서만 0보다 큼</li>
 * </ul>
 *
 * @param handle 작업 핸들
 * @param state 현재 상태
 * @param result 성공 결과
 * @param failure 실패 정보
 * @param submittedAtMillis 제출 시각 (epoch 밀리초)
 * @param startedAtMillis 실행 시작 시각 (epoch 밀리초, 미시작 시 0)
 * @param finishedAtMillis 종료 시각 (epoch 밀리초, 미종료 시 0)
 * @author LoadGuard Team
 * @since 1.0.0
 */
public record TaskStatus(
    TaskHandle handle,
    TaskState state,
    Object result,
    TaskFailure failure,
    long submittedAtMillis,
    long startedAtMillis,
    long finishedAtMillis
) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 필드 규칙 위반 시
     */
    public TaskStatus {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state == TaskState.FAILED && failure == null) {
            throw new IllegalArgumentException("failure cannot be null for FAILED state");
        }
        if (state != TaskState.FAILED && failure != null) {
            throw new IllegalArgumentException("failure must be null for state: " + state);
        }
        if (state != TaskState.SUCCEEDED && result != null) {
            throw new IllegalArgumentException("result must be null for state: " + state);
        }
    }

    /**
     * 제출 직후 상태 생성.
     *
     * @param handle 작업 핸들
     * @param submittedAtMillis 제출 시각
     * @return PENDING 상태
     */
    public static TaskStatus pending(TaskHandle handle, long submittedAtMillis) {
        return new TaskStatus(handle, TaskState.PENDING, null, null, submittedAtMillis, 0L, 0L);
    }

    /**
     * RUNNING으로 전이한 새 스냅샷.
     *
     * @param startedAtMillis 시작 시각
     * @return RUNNING 상태
     * @throws IllegalStateException 현재 상태에서 RUNNING 전이가 불가능한 경우
     */
    public TaskStatus toRunning(long startedAtMillis) {
        TaskStateTransition.validate(state, TaskState.RUNNING);
        return new TaskStatus(handle, TaskState.RUNNING, null, null, submittedAtMillis, startedAtMillis, 0L);
    }

    /**
     * SUCCEEDED로 전이한 새 스냅샷.
     *
     * @param result 작업 결과
     * @param finishedAtMillis 종료 시각
     * @return SUCCEEDED 상태
     * @throws IllegalStateException 현재 상태에서 SUCCEEDED 전이가 불가능한 경우
     */
    public TaskStatus toSucceeded(Object result, long finishedAtMillis) {
        TaskStateTransition.validate(state, TaskState.SUCCEEDED);
        return new TaskStatus(handle, TaskState.SUCCEEDED, result, null, submittedAtMillis, startedAtMillis, finishedAtMillis);
    }

    /**
     * FAILED로 전이한 새 스냅샷.
     *
     * @param failure 실패 정보
     * @param finishedAtMillis 종료 시각
     * @return FAILED 상태
     * @throws IllegalStateException 현재 상태에서 FAILED 전이가 불가능한 경우
     */
    public TaskStatus toFailed(TaskFailure failure, long finishedAtMillis) {
        TaskStateTransition.validate(state, TaskState.FAILED);
        return new TaskStatus(handle, TaskState.FAILED, null, failure, submittedAtMillis, startedAtMillis, finishedAtMillis);
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return state.isTerminal();
    }
}
