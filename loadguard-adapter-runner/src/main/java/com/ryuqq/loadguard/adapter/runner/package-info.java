/**
 * LoadGuard Runner Adapter - 보호 구성 요소 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.loadguard.adapter.runner.TokenBucketAdmissionController} - 키별 Token Bucket 처리율 제한</li>
 *   <li>{@link com.ryuqq.loadguard.adapter.runner.SingleFlightResultCache} - Single-flight TTL 캐시</li>
 *   <li>{@link com.ryuqq.loadguard.adapter.runner.CacheSweeper} - 만료 엔트리 주기 정리</li>
 *   <li>{@link com.ryuqq.loadguard.adapter.runner.WorkerPoolTaskExecutor} - 유한 워커 풀 지연 실행기</li>
 *   <li>{@link com.ryuqq.loadguard.adapter.runner.FixedResourcePool} - 블로킹 획득 Resource Pool</li>
 *   <li>{@link com.ryuqq.loadguard.adapter.runner.GuardedRequestPipeline} - Admission → Cache → Handler 조합</li>
 * </ul>
 *
 * <h2>로깅</h2>
 * <p>SLF4J API만 사용합니다. 바인딩은 애플리케이션이 선택합니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.adapter.runner;
