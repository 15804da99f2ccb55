/**
 * Store SPI 패키지.
 *
 * <p>버킷, 캐시 엔트리, 작업 상태를 보관하는 주입 가능한 저장소 계약입니다.
 * 참조 구현은 {@code loadguard-adapter-inmemory} 모듈에 있으며,
 * 구현 검증용 Contract Test는 {@code loadguard-testkit} 모듈에 있습니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.loadguard.core.spi.BucketStore} - 키 → TokenBucket</li>
 *   <li>{@link com.ryuqq.loadguard.core.spi.CacheStore} - Fingerprint → CacheEntry</li>
 *   <li>{@link com.ryuqq.loadguard.core.spi.TaskStore} - TaskHandle → TaskStatus</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.core.spi;
