package com.ryuqq.loadguard.core.task;

import com.ryuqq.loadguard.core.model.TaskHandle;

import java.util.concurrent.Callable;

/**
 * Deferred Task 실행자.
 *
 * <p>오래 걸리는 부수효과 작업을 요청 경로 밖에서 실행하고, 폴링 가능한 핸들을 반환합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>작업 제출 (비블로킹, PENDING 핸들 즉시 반환)</li>
 *   <li>고정 크기 워커 풀에서 실행, 워커가 모두 바쁘면 큐에 적재</li>
 *   <li>상태 조회 (PENDING, RUNNING, SUCCEEDED, FAILED) 및 결과/실패 사유 제공</li>
 * </ul>
 *
 * <p><strong>실패 의미:</strong></p>
 * <ul>
 *   <li>작업 예외 → FAILED로 기록, 제출자에게 던지지 않음, 자동 재시도 없음</li>
 *   <li>실행기 수준 실패 (큐 가득 참, 종료됨) → submit()에서 동기적으로 예외</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaskHandle handle = executor.submit(() -&gt; reportService.generate(request));
 * // HTTP 202 + /api/tasks/{handle}/status
 *
 * TaskStatus status = executor.status(handle);
 * if (status.isTerminal()) {
 *     ...
 * }
 * </pre>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface DeferredTaskExecutor {

    /**
     * 작업 제출.
     *
     * <p>작업 소요 시간과 무관하게 즉시 반환합니다.</p>
     *
     * @param work 실행할 작업
     * @return PENDING 상태의 핸들
     * @throws IllegalArgumentException work가 null인 경우
     * @throws java.util.concurrent.RejectedExecutionException 큐가 가득 찼거나 실행기가 종료된 경우
     */
    TaskHandle submit(Callable<?> work);

    /**
     * 작업 상태 조회.
     *
     * @param handle 작업 핸들
     * @return 현재 상태 스냅샷
     * @throws IllegalArgumentException handle이 null인 경우
     * @throws IllegalStateException handle에 해당하는 작업이 없는 경우
     */
    TaskStatus status(TaskHandle handle);

    /**
     * 시작 전 작업 취소.
     *
     * <p>PENDING 작업만 실행 없이 FAILED(TASK-CANCELLED)로 전이합니다.
     * RUNNING 또는 종료된 작업에는 영향을 주지 않습니다.</p>
     *
     * @param handle 작업 핸들
     * @return 취소된 경우 true
     * @throws IllegalStateException handle에 해당하는 작업이 없는 경우
     */
    boolean cancel(TaskHandle handle);

    /**
     * 종료 상태가 될 때까지 대기 (소프트 폴링).
     *
     * @param handle 작업 핸들
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 최신 상태 스냅샷 (타임아웃 시 비종료 상태일 수 있음)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws IllegalStateException handle에 해당하는 작업이 없는 경우
     */
    TaskStatus await(TaskHandle handle, long timeoutMs) throws InterruptedException;

    /**
     * 오래된 종료 작업 기록 제거.
     *
     * @param olderThanMs 종료 후 경과 시간 기준 (밀리초)
     * @return 제거된 기록 수
     */
    int purgeFinished(long olderThanMs);
}
