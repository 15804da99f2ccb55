/**
 * LoadGuard Application Layer - 요청 보호 Pipeline API.
 *
 * <p>Admission Controller, Result Cache, Deferred Task Executor를 하나의 요청 흐름으로
 * 조합하는 포트를 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.loadguard.application.pipeline.RequestPipeline} - Pipeline 포트</li>
 *   <li>{@link com.ryuqq.loadguard.application.pipeline.GuardedRequest} - 요청 식별 정보</li>
 *   <li>{@link com.ryuqq.loadguard.application.pipeline.PipelineResponse} - 처리 결과</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> PipelineResponse는 불변 객체</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.application.pipeline;
