package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.application.pipeline.GuardedRequest;
import com.ryuqq.loadguard.application.pipeline.PipelineResponse;
import com.ryuqq.loadguard.application.pipeline.RequestPipeline;
import com.ryuqq.loadguard.core.admission.AdmissionController;
import com.ryuqq.loadguard.core.admission.AdmissionDecision;
import com.ryuqq.loadguard.core.cache.ResultCache;
import com.ryuqq.loadguard.core.model.TaskHandle;
import com.ryuqq.loadguard.core.task.DeferredTaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * {@link RequestPipeline} 기본 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * handle(request, handler)
 *   1. admission.evaluate(clientKey) → 거절 시 REJECTED(retryAfterMillis)
 *   2. cache.getOrCompute(fingerprint, handler) → COMPLETED(value, fromCache)
 *
 * handleDeferred(request, work)
 *   1. admission.evaluate(clientKey) → 거절 시 REJECTED(retryAfterMillis)
 *   2. executor.submit(work) → ACCEPTED(handle, /api/tasks/{handle}/status)
 * </pre>
 *
 * <p>fromCache는 이 호출의 handler가 실행되지 않은 경우 true입니다.
 * single-flight 대기자로서 다른 호출의 계산 결과를 받은 경우도 포함합니다.</p>
 *
 * @param <V> 동기 처리 결과 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class GuardedRequestPipeline<V> implements RequestPipeline<V> {

    private static final Logger log = LoggerFactory.getLogger(GuardedRequestPipeline.class);

    private final AdmissionController admission;
    private final ResultCache<V> cache;
    private final DeferredTaskExecutor executor;

    /**
     * 생성자.
     *
     * @param admission Admission Controller
     * @param cache Result Cache
     * @param executor Deferred Task Executor
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public GuardedRequestPipeline(AdmissionController admission, ResultCache<V> cache, DeferredTaskExecutor executor) {
        if (admission == null) {
            throw new IllegalArgumentException("admission cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.admission = admission;
        this.cache = cache;
        this.executor = executor;
    }

    @Override
    public PipelineResponse<V> handle(GuardedRequest request, Supplier<V> handler) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        AdmissionDecision decision = admission.evaluate(request.clientKey());
        if (!decision.allowed()) {
            return PipelineResponse.rejected(decision.retryAfterMillis());
        }

        AtomicBoolean computed = new AtomicBoolean(false);
        V value = cache.getOrCompute(request.fingerprint(), () -> {
            computed.set(true);
            return handler.get();
        });

        log.debug("Request {} completed (fromCache: {})", request.fingerprint(), !computed.get());
        return PipelineResponse.completed(value, !computed.get());
    }

    @Override
    public PipelineResponse<V> handleDeferred(GuardedRequest request, Callable<?> work) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }

        AdmissionDecision decision = admission.evaluate(request.clientKey());
        if (!decision.allowed()) {
            return PipelineResponse.rejected(decision.retryAfterMillis());
        }

        TaskHandle handle = executor.submit(work);
        return PipelineResponse.accepted(handle, String.format(STATUS_URL_FORMAT, handle.getValue()));
    }
}
