package com.ryuqq.loadguard.core.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 풀에서 대여한 리소스 핸들.
 *
 * <p>대여마다 새 핸들이 발급되며, 반납 후에는 재사용할 수 없습니다.
 * {@link AutoCloseable}이므로 try-with-resources로 모든 종료 경로에서 반납을 보장합니다.</p>
 *
 * @param <R> 리소스 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class PooledResource<R> implements AutoCloseable {

    private final ResourcePool<R> owner;
    private final int slot;
    private final R resource;
    private final AtomicBoolean released = new AtomicBoolean(false);

    /**
     * 생성자 (풀 구현체 전용).
     *
     * @param owner 발급한 풀
     * @param slot 슬롯 번호 (0 ~ poolSize-1)
     * @param resource 리소스
     * @throws IllegalArgumentException owner 또는 resource가 null이거나 slot이 음수인 경우
     */
    public PooledResource(ResourcePool<R> owner, int slot, R resource) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (slot < 0) {
            throw new IllegalArgumentException("slot cannot be negative (current: " + slot + ")");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        this.owner = owner;
        this.slot = slot;
        this.resource = resource;
    }

    /**
     * 리소스 조회.
     *
     * @return 리소스
     * @throws IllegalStateException 이미 반납된 경우
     */
    public R get() {
        if (released.get()) {
            throw new IllegalStateException("Resource in slot " + slot + " has already been released");
        }
        return resource;
    }

    /**
     * 슬롯 번호 조회.
     *
     * @return 슬롯 번호
     */
    public int slot() {
        return slot;
    }

    /**
     * 이 핸들을 발급한 풀인지 확인.
     *
     * @param pool 확인할 풀
     * @return 같은 풀이면 true
     */
    public boolean belongsTo(ResourcePool<?> pool) {
        return owner == pool;
    }

    /**
     * 반납 여부.
     *
     * @return 반납된 경우 true
     */
    public boolean isReleased() {
        return released.get();
    }

    /**
     * 반납 표시 (풀 구현체 전용).
     *
     * <p>최초 1회만 성공합니다.</p>
     *
     * @return 이번 호출로 반납 표시된 경우 true, 이미 반납된 경우 false
     */
    public boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    /**
     * 원래 리소스 조회 (풀 구현체 전용, 반납 여부와 무관).
     *
     * @return 리소스
     */
    public R unwrap() {
        return resource;
    }

    /**
     * 풀에 반납.
     *
     * <p>이미 반납된 핸들이면 아무 동작도 하지 않으므로, 명시적 release 후 close가 호출되어도 안전합니다.</p>
     */
    @Override
    public void close() {
        if (!released.get()) {
            owner.release(this);
        }
    }

    @Override
    public String toString() {
        return "PooledResource{slot=" + slot + ", released=" + released.get() + "}";
    }
}
