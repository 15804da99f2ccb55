package com.ryuqq.loadguard.application.pipeline;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * 요청 보호 Pipeline.
 *
 * <p>Admission → Cache → Handler 순서로 구성 요소를 조합합니다.
 * 각 구성 요소는 독립적으로도 사용할 수 있으며, 이 인터페이스는 그 중 하나의 조합입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GuardedRequest request = GuardedRequest.of(apiKey, "GET", path);
 * PipelineResponse&lt;Report&gt; response = pipeline.handle(request, () -&gt; reportService.build(path));
 *
 * GuardedRequest export = GuardedRequest.of(apiKey, "POST", "/api/exports");
 * PipelineResponse&lt;Report&gt; accepted = pipeline.handleDeferred(export, () -&gt; exporter.run());
 * // 202 Accepted + accepted.getStatusUrlOrNull()
 * </pre>
 *
 * @param <V> 동기 처리 결과 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface RequestPipeline<V> {

    /**
     * 상태 조회 URL 형식. {@code %s}는 TaskHandle 값으로 치환됩니다.
     */
    String STATUS_URL_FORMAT = "/api/tasks/%s/status";

    /**
     * 동기 처리.
     *
     * <ol>
     *   <li>Admission 거절 → REJECTED (retryAfterMillis 포함)</li>
     *   <li>캐시 적중 → COMPLETED (fromCache = true)</li>
     *   <li>같은 fingerprint의 진행 중 계산을 기다려 결과를 받음 → COMPLETED (fromCache = true)</li>
     *   <li>캐시 미스 → handler 실행 후 COMPLETED (fromCache = false)</li>
     * </ol>
     *
     * <p>fromCache는 "이 호출의 handler가 실행되지 않았음"을 뜻합니다.
     * 저장소에서 읽었는지 여부와는 구분됩니다.</p>
     *
     * <p>handler 예외는 캐시되지 않고 호출자에게 그대로 전파됩니다.</p>
     *
     * @param request 요청 식별 정보
     * @param handler 실제 요청 처리기
     * @return 처리 결과
     * @throws IllegalArgumentException request 또는 handler가 null인 경우
     */
    PipelineResponse<V> handle(GuardedRequest request, Supplier<V> handler);

    /**
     * 지연 처리.
     *
     * <p>Admission 통과 시 작업을 제출하고 즉시 ACCEPTED를 반환합니다.</p>
     *
     * @param request 요청 식별 정보
     * @param work 요청 경로 밖에서 실행할 작업
     * @return REJECTED 또는 ACCEPTED
     * @throws java.util.concurrent.RejectedExecutionException 작업 큐가 가득 찬 경우
     */
    PipelineResponse<V> handleDeferred(GuardedRequest request, Callable<?> work);
}
