package com.ryuqq.loadguard.application.pipeline;

import com.ryuqq.loadguard.core.model.TaskHandle;

/**
 * Pipeline 처리 결과.
 *
 * <p><strong>세 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>REJECTED:</strong> retryAfterMillis만 유효 (HTTP 429 + Retry-After)</li>
 *   <li><strong>COMPLETED:</strong> body와 fromCache가 유효 (HTTP 200)</li>
 *   <li><strong>ACCEPTED:</strong> taskHandle과 statusUrl이 유효 (HTTP 202)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PipelineResponse&lt;Product&gt; response = pipeline.handle(request, () -&gt; repository.load(id));
 * switch (response.getKind()) {
 *     case REJECTED -&gt; reply(429, response.getRetryAfterMillis());
 *     case COMPLETED -&gt; reply(200, response.getBodyOrNull());
 *     default -&gt; reply(202, response.getStatusUrlOrNull());
 * }
 * </pre>
 *
 * @param <V> 응답 본문 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class PipelineResponse<V> {

    private final ResponseKind kind;
    private final V bodyOrNull;
    private final boolean fromCache;
    private final long retryAfterMillis;
    private final TaskHandle taskHandleOrNull;
    private final String statusUrlOrNull;

    private PipelineResponse(ResponseKind kind, V bodyOrNull, boolean fromCache, long retryAfterMillis,
                             TaskHandle taskHandleOrNull, String statusUrlOrNull) {
        this.kind = kind;
        this.bodyOrNull = bodyOrNull;
        this.fromCache = fromCache;
        this.retryAfterMillis = retryAfterMillis;
        this.taskHandleOrNull = taskHandleOrNull;
        this.statusUrlOrNull = statusUrlOrNull;
    }

    /**
     * 거절 응답 생성.
     *
     * @param retryAfterMillis 재시도까지 권장 대기 시간 (0 이상)
     * @return REJECTED 응답
     * @throws IllegalArgumentException retryAfterMillis가 음수인 경우
     */
    public static <V> PipelineResponse<V> rejected(long retryAfterMillis) {
        if (retryAfterMillis < 0) {
            throw new IllegalArgumentException(
                "retryAfterMillis cannot be negative (current: " + retryAfterMillis + ")"
            );
        }
        return new PipelineResponse<>(ResponseKind.REJECTED, null, false, retryAfterMillis, null, null);
    }

    /**
     * 완료 응답 생성.
     *
     * @param body 결과 값 (null 불가)
     * @param fromCache 이 호출의 handler가 실행되지 않은 경우 true
     * @return COMPLETED 응답
     * @throws IllegalArgumentException body가 null인 경우
     */
    public static <V> PipelineResponse<V> completed(V body, boolean fromCache) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null for completed response");
        }
        return new PipelineResponse<>(ResponseKind.COMPLETED, body, fromCache, 0L, null, null);
    }

    /**
     * 수락 응답 생성.
     *
     * @param taskHandle 작업 핸들
     * @param statusUrl 상태 조회 URL (예: /api/tasks/{handle}/status)
     * @return ACCEPTED 응답
     * @throws IllegalArgumentException taskHandle이 null이거나 statusUrl이 null/blank인 경우
     */
    public static <V> PipelineResponse<V> accepted(TaskHandle taskHandle, String statusUrl) {
        if (taskHandle == null) {
            throw new IllegalArgumentException("taskHandle cannot be null for accepted response");
        }
        if (statusUrl == null || statusUrl.isBlank()) {
            throw new IllegalArgumentException("statusUrl cannot be null or blank for accepted response");
        }
        return new PipelineResponse<>(ResponseKind.ACCEPTED, null, false, 0L, taskHandle, statusUrl);
    }

    public ResponseKind getKind() {
        return kind;
    }

    /**
     * 결과 값 조회.
     *
     * @return COMPLETED인 경우 결과 값, 그 외 null
     */
    public V getBodyOrNull() {
        return bodyOrNull;
    }

    /**
     * 캐시 적중 여부.
     *
     * <p>저장된 값의 적중뿐 아니라 다른 호출의 진행 중 계산 결과를 공유받은 경우도 포함합니다.</p>
     *
     * @return COMPLETED이고 이 호출의 handler가 실행되지 않은 경우 true
     */
    public boolean isFromCache() {
        return fromCache;
    }

    /**
     * 재시도 권장 대기 시간.
     *
     * @return REJECTED인 경우 밀리초, 그 외 0
     */
    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }

    public TaskHandle getTaskHandleOrNull() {
        return taskHandleOrNull;
    }

    public String getStatusUrlOrNull() {
        return statusUrlOrNull;
    }

    @Override
    public String toString() {
        switch (kind) {
            case REJECTED:
                return "PipelineResponse{kind=REJECTED, retryAfterMillis=" + retryAfterMillis + "}";
            case COMPLETED:
                return "PipelineResponse{kind=COMPLETED, fromCache=" + fromCache + ", body=" + bodyOrNull + "}";
            default:
                return "PipelineResponse{kind=ACCEPTED, task=" + taskHandleOrNull + ", statusUrl=" + statusUrlOrNull + "}";
        }
    }
}
