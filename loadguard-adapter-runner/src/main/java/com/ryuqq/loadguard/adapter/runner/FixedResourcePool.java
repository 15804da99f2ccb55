package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.core.pool.PoolConfig;
import com.ryuqq.loadguard.core.pool.PooledResource;
import com.ryuqq.loadguard.core.pool.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 고정 크기 Resource Pool.
 *
 * <p>초기화 시점에 poolSize개의 리소스를 만들어 두고, 획득/반납을 하나의
 * {@link ReentrantLock}과 {@link Condition}으로 조정합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>유휴 리소스가 있으면 즉시 반환</li>
 *   <li>없으면 timeoutMs까지 대기, 그래도 없으면 {@link TimeoutException}</li>
 *   <li>반납 시 대기자 하나를 깨움 (fair=true면 가장 오래 기다린 순서)</li>
 *   <li>이미 반납된 핸들이나 다른 풀의 핸들 반납 시 {@link IllegalStateException}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResourcePool&lt;Connection&gt; pool = new FixedResourcePool&lt;&gt;(dataSource::open, new PoolConfig(8, 500, true), Connection::close);
 *
 * try (PooledResource&lt;Connection&gt; connection = pool.acquire()) {
 *     connection.get().execute(sql);
 * }
 * </pre>
 *
 * @param <R> 리소스 타입
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class FixedResourcePool<R> implements ResourcePool<R> {

    private static final Logger log = LoggerFactory.getLogger(FixedResourcePool.class);

    private final PoolConfig config;
    private final List<R> resources;
    private final Consumer<R> disposer;
    private final ReentrantLock lock;
    private final Condition released;
    private final Deque<Integer> idleSlots;
    private final List<PooledResource<R>> leased;
    private boolean shutdown;

    /**
     * factory로 poolSize개의 리소스를 생성하는 생성자.
     *
     * @param factory 리소스 생성기 (null 반환 불가)
     * @param config 설정
     */
    public FixedResourcePool(Supplier<R> factory, PoolConfig config) {
        this(factory, config, null);
    }

    /**
     * factory로 poolSize개의 리소스를 생성하는 생성자.
     *
     * @param factory 리소스 생성기 (null 반환 불가)
     * @param config 설정
     * @param disposer shutdown 시 리소스 정리 함수 (null이면 정리하지 않음)
     */
    public FixedResourcePool(Supplier<R> factory, PoolConfig config, Consumer<R> disposer) {
        this(create(factory, config), config, disposer);
    }

    /**
     * 미리 만든 리소스 목록으로 생성.
     *
     * @param resources 리소스 목록 (크기는 poolSize와 같아야 함)
     * @param config 설정
     */
    public FixedResourcePool(List<R> resources, PoolConfig config) {
        this(resources, config, null);
    }

    /**
     * 미리 만든 리소스 목록으로 생성.
     *
     * @param resources 리소스 목록 (크기는 poolSize와 같아야 함, null 원소 불가)
     * @param config 설정
     * @param disposer shutdown 시 리소스 정리 함수 (null이면 정리하지 않음)
     * @throws IllegalArgumentException 목록 크기가 poolSize와 다르거나 null 원소가 있는 경우
     */
    public FixedResourcePool(List<R> resources, PoolConfig config, Consumer<R> disposer) {
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (resources.size() != config.poolSize()) {
            throw new IllegalArgumentException(
                "resources size must match poolSize (size: " + resources.size() + ", poolSize: " + config.poolSize() + ")"
            );
        }
        for (int i = 0; i < resources.size(); i++) {
            if (resources.get(i) == null) {
                throw new IllegalArgumentException("resources cannot contain null (index: " + i + ")");
            }
        }

        this.config = config;
        this.resources = List.copyOf(resources);
        this.disposer = disposer;
        this.lock = new ReentrantLock(config.fair());
        this.released = lock.newCondition();
        this.idleSlots = new ArrayDeque<>(config.poolSize());
        this.leased = new ArrayList<>(config.poolSize());
        for (int slot = 0; slot < config.poolSize(); slot++) {
            idleSlots.addLast(slot);
            leased.add(null);
        }
    }

    @Override
    public PooledResource<R> acquire(long timeoutMs) throws InterruptedException, TimeoutException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }

        long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        lock.lockInterruptibly();
        try {
            while (idleSlots.isEmpty() && !shutdown) {
                if (remainingNanos <= 0) {
                    throw new TimeoutException(
                        "No resource available within " + timeoutMs + "ms (poolSize: " + config.poolSize() + ")"
                    );
                }
                remainingNanos = released.awaitNanos(remainingNanos);
            }
            if (shutdown) {
                throw new IllegalStateException("ResourcePool has been shut down");
            }

            int slot = idleSlots.pollFirst();
            PooledResource<R> handle = new PooledResource<>(this, slot, resources.get(slot));
            leased.set(slot, handle);
            return handle;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(PooledResource<R> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (!handle.belongsTo(this)) {
            throw new IllegalStateException("Handle does not belong to this pool: " + handle);
        }

        R toDispose = null;
        lock.lock();
        try {
            int slot = handle.slot();
            if (slot >= leased.size() || leased.get(slot) != handle || !handle.markReleased()) {
                throw new IllegalStateException("Handle already released: " + handle);
            }
            leased.set(slot, null);

            if (shutdown) {
                toDispose = resources.get(slot);
            } else {
                idleSlots.addLast(slot);
                released.signal();
            }
        } finally {
            lock.unlock();
        }

        if (toDispose != null) {
            dispose(toDispose);
        }
    }

    @Override
    public int available() {
        lock.lock();
        try {
            return idleSlots.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int inUse() {
        lock.lock();
        try {
            int count = 0;
            for (PooledResource<R> handle : leased) {
                if (handle != null) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PoolConfig getConfig() {
        return config;
    }

    /**
     * Pool 종료.
     *
     * <p>이후 acquire()는 {@link IllegalStateException}으로 실패하고, 대기 중인 스레드도 같은 예외로 깨어납니다.
     * 유휴 리소스는 즉시, 사용 중인 리소스는 반납 시점에 disposer로 전달됩니다.</p>
     */
    public void shutdown() {
        List<R> idle = new ArrayList<>();
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            for (Integer slot : idleSlots) {
                idle.add(resources.get(slot));
            }
            idleSlots.clear();
            released.signalAll();
        } finally {
            lock.unlock();
        }

        for (R resource : idle) {
            dispose(resource);
        }
        log.info("ResourcePool shut down ({} idle resources disposed)", idle.size());
    }

    /**
     * 종료 여부.
     *
     * @return shutdown() 호출 이후 true
     */
    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    private void dispose(R resource) {
        if (disposer == null) {
            return;
        }
        try {
            disposer.accept(resource);
        } catch (RuntimeException e) {
            log.warn("Failed to dispose pooled resource {}", resource, e);
        }
    }

    private static <R> List<R> create(Supplier<R> factory, PoolConfig config) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        List<R> created = new ArrayList<>(config.poolSize());
        for (int i = 0; i < config.poolSize(); i++) {
            R resource = factory.get();
            if (resource == null) {
                throw new IllegalArgumentException("factory returned null (index: " + i + ")");
            }
            created.add(resource);
        }
        return created;
    }
}
