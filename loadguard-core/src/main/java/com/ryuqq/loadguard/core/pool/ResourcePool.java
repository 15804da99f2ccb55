package com.ryuqq.loadguard.core.pool;

import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Resource Pool SPI.
 *
 * <p>DB 커넥션처럼 희소한 하위 리소스에 대한 동시 접근 수를 풀 크기로 제한합니다.
 * 풀이 소진되면 호출자는 타임아웃까지 대기합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>대여 중인 핸들 수 &lt;= poolSize</li>
 *   <li>핸들은 acquire ~ release 사이에 정확히 한 호출자만 소유</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResourcePool<Connection> pool = ...;
 *
 * try (PooledResource<Connection> handle = pool.acquire(500)) {
 *     return query(handle.get());
 * } catch (TimeoutException e) {
 *     // 일시적 실패: 재시도 또는 degrade
 * }
 * }</pre>
 *
 * @param <R> 리소스 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface ResourcePool<R> {

    /**
     * 리소스 대여 (타임아웃 대기).
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 0이면 즉시 판단)
     * @return 대여 핸들
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws TimeoutException 타임아웃 내에 반납된 리소스가 없는 경우
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     * @throws IllegalStateException 풀이 종료된 경우
     */
    PooledResource<R> acquire(long timeoutMs) throws InterruptedException, TimeoutException;

    /**
     * 리소스 대여 (설정된 기본 타임아웃).
     *
     * @return 대여 핸들
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws TimeoutException 기본 타임아웃 내에 반납된 리소스가 없는 경우
     */
    default PooledResource<R> acquire() throws InterruptedException, TimeoutException {
        return acquire(getConfig().defaultAcquireTimeoutMs());
    }

    /**
     * 리소스 반납.
     *
     * <p>대기자가 있으면 하나를 깨웁니다.</p>
     *
     * @param handle 대여 핸들
     * @throws IllegalArgumentException handle이 null인 경우
     * @throws IllegalStateException 이미 반납되었거나 다른 풀의 핸들인 경우
     */
    void release(PooledResource<R> handle);

    /**
     * 리소스를 대여하여 작업 수행 후 반납.
     *
     * <p>작업이 예외를 던져도 반드시 반납합니다.</p>
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @param work 리소스를 사용하는 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws TimeoutException 타임아웃 내에 대여하지 못한 경우
     */
    default <T> T withResource(long timeoutMs, Function<R, T> work) throws InterruptedException, TimeoutException {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        try (PooledResource<R> handle = acquire(timeoutMs)) {
            return work.apply(handle.get());
        }
    }

    /**
     * 현재 대여 가능한 리소스 수.
     *
     * @return 유휴 리소스 수
     */
    int available();

    /**
     * 현재 대여 중인 리소스 수.
     *
     * @return 대여 중 리소스 수
     */
    int inUse();

    /**
     * 풀 설정 정보 조회.
     *
     * @return 풀 설정
     */
    PoolConfig getConfig();
}
