/**
 * Resource Pool 패키지.
 *
 * <p>고정 개수의 교체 가능한 리소스 핸들을 대여/반납하는 계약입니다.
 * 대여는 타임아웃과 함께 블로킹하며, 타임아웃 시 {@link java.util.concurrent.TimeoutException}을 던집니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.core.pool;
