/**
 * 시간 소스 패키지.
 *
 * <p>모든 시간 의존 컴포넌트는 {@link com.ryuqq.loadguard.core.clock.Clock}을 주입받습니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.core.clock;
