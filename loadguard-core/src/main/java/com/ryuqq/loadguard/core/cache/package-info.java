/**
 * Result Cache 패키지.
 *
 * <p>TTL 기반 결과 캐시와 Fingerprint별 single-flight 계약을 정의합니다.
 * 구현체는 {@code loadguard-adapter-runner}의 {@code SingleFlightResultCache}입니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.core.cache;
