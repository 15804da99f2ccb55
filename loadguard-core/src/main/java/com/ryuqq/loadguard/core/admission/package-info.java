/**
 * Admission Control 패키지.
 *
 * <p>요청이 핸들러에 도달하기 전에 키별 Token Bucket으로 허용/거부를 결정합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.loadguard.core.admission.AdmissionController} - 허용 여부 결정 SPI</li>
 *   <li>{@link com.ryuqq.loadguard.core.admission.TokenBucket} - 키 하나의 버킷 상태와 알고리즘</li>
 *   <li>{@link com.ryuqq.loadguard.core.admission.AdmissionConfig} - capacity / refillTokens / refillIntervalMs</li>
 *   <li>{@link com.ryuqq.loadguard.core.admission.AdmissionDecision} - 허용 여부 + Retry-After 힌트</li>
 * </ul>
 *
 * <h2>거부 처리</h2>
 *
 * <p>거부는 예외가 아닌 boolean 결과입니다. HTTP 계층이 {@code false}를 429 응답으로 변환합니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.loadguard.core.admission.noop.NoOpAdmissionController}는
 * 모든 요청을 허용합니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.core.admission;
