package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.core.clock.Clock;
import com.ryuqq.loadguard.core.model.TaskHandle;
import com.ryuqq.loadguard.core.spi.TaskStore;
import com.ryuqq.loadguard.core.statemachine.TaskState;
import com.ryuqq.loadguard.core.task.DeferredTaskExecutor;
import com.ryuqq.loadguard.core.task.TaskFailure;
import com.ryuqq.loadguard.core.task.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker Pool 기반 Deferred Task Executor.
 *
 * <p>고정 크기 워커 풀과 (유한 또는 무제한) 대기 큐로 요청 경로 밖에서 작업을 실행하고,
 * 각 작업의 상태를 {@link TaskStore}에 기록합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(work)
 *   ↓
 * 1. TaskHandle 생성 → TaskStore.create(PENDING)
 * 2. 워커 풀에 제출
 *    - 큐 가득 참 → 기록 제거 후 RejectedExecutionException
 * 3. 즉시 핸들 반환
 *
 * Worker:
 *   1. transitionIf(PENDING → RUNNING) (이미 취소된 작업은 건너뜀)
 *   2. work.call()
 *   3. 성공 → SUCCEEDED(result) / 예외 → FAILED(TASK-ERROR)
 * </pre>
 *
 * <p><strong>특징:</strong></p>
 * <ul>
 *   <li>작업 실패는 호출자에게 던지지 않고 상태로 기록</li>
 *   <li>자동 재시도 없음</li>
 *   <li>시작 전 작업은 cancel() 또는 shutdown()으로 FAILED 처리 가능</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class WorkerPoolTaskExecutor implements DeferredTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolTaskExecutor.class);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final TaskStore taskStore;
    private final Clock clock;
    private final WorkerPoolConfig config;
    private final ThreadPoolExecutor workerPool;

    /**
     * 생성자.
     *
     * @param taskStore 작업 상태 저장소
     * @param clock 시간 소스 (상태 타임스탬프)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerPoolTaskExecutor(TaskStore taskStore, Clock clock, WorkerPoolConfig config) {
        if (taskStore == null) {
            throw new IllegalArgumentException("taskStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.taskStore = taskStore;
        this.clock = clock;
        this.config = config;
        this.workerPool = createWorkerPool(config);
    }

    @Override
    public TaskHandle submit(Callable<?> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (workerPool.isShutdown()) {
            throw new RejectedExecutionException("Executor has been shut down");
        }

        TaskHandle handle = TaskHandle.generate();
        taskStore.create(TaskStatus.pending(handle, clock.nowMillis()));

        try {
            workerPool.execute(new DeferredTask(handle, work));
        } catch (RejectedExecutionException e) {
            taskStore.remove(handle);
            log.warn("Task rejected (queue size: {}, shutdown: {})", workerPool.getQueue().size(), workerPool.isShutdown());
            throw e;
        }

        log.debug("Task {} submitted", handle);
        return handle;
    }

    @Override
    public TaskStatus status(TaskHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        return taskStore.find(handle)
            .orElseThrow(() -> new IllegalStateException("Unknown task handle: " + handle.getValue()));
    }

    @Override
    public boolean cancel(TaskHandle handle) {
        status(handle);
        boolean cancelled = taskStore.transitionIf(handle, TaskState.PENDING,
            s -> s.toFailed(TaskFailure.cancelled(), clock.nowMillis())).isPresent();
        if (cancelled) {
            log.info("Task {} cancelled before start", handle);
        }
        return cancelled;
    }

    /**
     * 작업 종료 대기 (소프트 폴링).
     *
     * <p>pollingIntervalMs 간격으로 상태를 확인하며, 타임아웃 시 마지막 상태를 그대로 반환합니다.</p>
     */
    @Override
    public TaskStatus await(TaskHandle handle, long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        TaskStatus current = status(handle);
        while (!current.isTerminal()) {
            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                return current;
            }
            long sleepMs = Math.min(config.pollingIntervalMs(), TimeUnit.NANOSECONDS.toMillis(remainingNanos) + 1);
            Thread.sleep(sleepMs);
            current = status(handle);
        }
        return current;
    }

    @Override
    public int purgeFinished(long olderThanMs) {
        if (olderThanMs < 0) {
            throw new IllegalArgumentException("olderThanMs cannot be negative (current: " + olderThanMs + ")");
        }
        int purged = taskStore.removeFinishedBefore(clock.nowMillis() - olderThanMs);
        if (purged > 0) {
            log.info("Purged {} finished task records older than {}ms", purged, olderThanMs);
        }
        return purged;
    }

    /**
     * Executor 종료.
     *
     * <p>대기 큐의 작업은 시작하지 않고 FAILED(TASK-ABORTED)로 기록하며,
     * 실행 중인 작업은 shutdownTimeoutMs 동안 완료를 기다린 뒤 인터럽트합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        List<Runnable> neverStarted = new ArrayList<>();
        workerPool.shutdown();
        workerPool.getQueue().drainTo(neverStarted);
        int aborted = abortAll(neverStarted);

        if (!workerPool.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Workers did not finish within {}ms, interrupting", config.shutdownTimeoutMs());
            aborted += abortAll(workerPool.shutdownNow());
        }
        log.info("WorkerPoolTaskExecutor shut down ({} queued tasks aborted)", aborted);
    }

    /**
     * 종료 여부.
     *
     * @return shutdown() 호출 이후 true
     */
    public boolean isShutdown() {
        return workerPool.isShutdown();
    }

    /**
     * 대기 큐에 있는 작업 수.
     *
     * @return 시작 대기 중인 작업 수
     */
    public int queuedCount() {
        return workerPool.getQueue().size();
    }

    public WorkerPoolConfig getConfig() {
        return config;
    }

    private int abortAll(List<Runnable> runnables) {
        int aborted = 0;
        for (Runnable runnable : runnables) {
            if (runnable instanceof DeferredTask) {
                TaskHandle handle = ((DeferredTask) runnable).handle;
                boolean changed = taskStore.transitionIf(handle, TaskState.PENDING,
                    s -> s.toFailed(TaskFailure.aborted(), clock.nowMillis())).isPresent();
                if (changed) {
                    aborted++;
                }
            }
        }
        return aborted;
    }

    private static ThreadPoolExecutor createWorkerPool(WorkerPoolConfig config) {
        BlockingQueue<Runnable> queue = config.isUnbounded()
            ? new LinkedBlockingQueue<>()
            : new ArrayBlockingQueue<>(config.queueCapacity());

        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();

        return new ThreadPoolExecutor(
            config.workerCount(),
            config.workerCount(),
            0L, TimeUnit.MILLISECONDS,
            queue,
            runnable -> new Thread(runnable, "loadguard-worker-" + poolId + "-" + threadSequence.incrementAndGet()),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 워커가 실행하는 단위 작업.
     */
    private final class DeferredTask implements Runnable {

        private final TaskHandle handle;
        private final Callable<?> work;

        private DeferredTask(TaskHandle handle, Callable<?> work) {
            this.handle = handle;
            this.work = work;
        }

        @Override
        public void run() {
            Optional<TaskStatus> running = taskStore.transitionIf(handle, TaskState.PENDING,
                s -> s.toRunning(clock.nowMillis()));
            if (running.isEmpty()) {
                log.debug("Task {} skipped: no longer PENDING", handle);
                return;
            }

            try {
                Object result = work.call();
                taskStore.transitionIf(handle, TaskState.RUNNING,
                    s -> s.toSucceeded(result, clock.nowMillis()));
                log.debug("Task {} succeeded", handle);

            } catch (Exception e) {
                recordFailure(e);

            } catch (Error e) {
                recordFailure(e);
                throw e;
            }
        }

        private void recordFailure(Throwable e) {
            TaskFailure failure = TaskFailure.fromThrowable(e);
            taskStore.transitionIf(handle, TaskState.RUNNING,
                s -> s.toFailed(failure, clock.nowMillis()));
            log.warn("Task {} failed: {}", handle, failure.message());
        }
    }
}
