package com.ryuqq.loadguard.core.spi;

import com.ryuqq.loadguard.core.model.TaskHandle;
import com.ryuqq.loadguard.core.statemachine.TaskState;
import com.ryuqq.loadguard.core.task.TaskStatus;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Deferred Task 상태 저장소 SPI.
 *
 * <p>작업 상태 스냅샷({@link TaskStatus})을 핸들별로 보관합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>thread-safe</li>
 *   <li>{@link #transitionIf}는 원자적 compare-and-set: 취소(PENDING→FAILED)와
 *       워커 시작(PENDING→RUNNING)이 경합해도 하나만 성공해야 함</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface TaskStore {

    /**
     * 새 작업 기록 생성.
     *
     * @param status PENDING 상태 스냅샷
     * @throws IllegalArgumentException status가 null이거나 PENDING이 아닌 경우
     * @throws IllegalStateException 같은 핸들이 이미 존재하는 경우
     */
    void create(TaskStatus status);

    /**
     * 작업 상태 조회.
     *
     * @param handle 작업 핸들
     * @return 상태 (없으면 empty)
     * @throws IllegalArgumentException handle이 null인 경우
     */
    Optional<TaskStatus> find(TaskHandle handle);

    /**
     * 현재 상태가 expected일 때만 mutation을 적용.
     *
     * @param handle 작업 핸들
     * @param expected 기대하는 현재 상태
     * @param mutation 새 스냅샷 생성 함수 (현재 스냅샷 → 다음 스냅샷)
     * @return 적용된 새 스냅샷, 현재 상태가 expected가 아니면 empty
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException handle에 해당하는 작업이 없는 경우
     */
    Optional<TaskStatus> transitionIf(TaskHandle handle, TaskState expected, UnaryOperator<TaskStatus> mutation);

    /**
     * 작업 기록 제거.
     *
     * @param handle 작업 핸들
     * @return 제거된 경우 true
     */
    boolean remove(TaskHandle handle);

    /**
     * 기준 시각 이전에 종료된 작업 기록 제거.
     *
     * @param finishedBeforeMillis 기준 시각 (epoch 밀리초, 미만이면 제거)
     * @return 제거된 기록 수
     */
    int removeFinishedBefore(long finishedBeforeMillis);

    /**
     * 저장된 작업 기록 수.
     *
     * @return 기록 수
     */
    int size();

    /**
     * 모든 기록 제거.
     */
    void clear();
}
