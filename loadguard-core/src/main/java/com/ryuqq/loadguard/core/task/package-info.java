/**
 * Deferred Task 패키지.
 *
 * <p>요청 경로 밖에서 실행되는 작업의 제출/조회 계약과 상태 스냅샷을 정의합니다.
 * 상태 전이 규칙은 {@link com.ryuqq.loadguard.core.statemachine}에 있습니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.core.task;
