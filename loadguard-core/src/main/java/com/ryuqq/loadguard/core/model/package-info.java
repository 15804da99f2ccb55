/**
 * Value Object 패키지.
 *
 * <p>컴포넌트 간에 공유되는 식별자를 정의합니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.loadguard.core.model.Fingerprint} - Result Cache 키</li>
 *   <li>{@link com.ryuqq.loadguard.core.model.TaskHandle} - Deferred Task 핸들</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.core.model;
