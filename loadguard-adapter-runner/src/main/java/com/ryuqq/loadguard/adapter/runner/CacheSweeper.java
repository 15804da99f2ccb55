package com.ryuqq.loadguard.adapter.runner;

import com.ryuqq.loadguard.core.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * CacheSweeper 컴포넌트.
 *
 * <p>만료되었지만 다시 조회되지 않아 남아 있는 캐시 엔트리를 주기적으로 제거합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>만료 엔트리 스캔 및 제거 ({@link ResultCache#evictExpired()})</li>
 *   <li>예외 발생 시에도 다음 주기에 계속 진행</li>
 * </ul>
 *
 * <p>{@link #sweep()}는 외부 스케줄러(예: @Scheduled)에서 직접 호출할 수도 있고,
 * {@link #start()}로 내장 스케줄러를 사용할 수도 있습니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final ResultCache<?> cache;
    private final CacheSweeperConfig config;
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param cache 정리 대상 캐시
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CacheSweeper(ResultCache<?> cache, CacheSweeperConfig config) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cache = cache;
        this.config = config;
    }

    /**
     * 만료 엔트리 1회 정리.
     *
     * @return 제거된 엔트리 수 (실패 시 0)
     */
    public int sweep() {
        try {
            int evicted = cache.evictExpired();
            if (evicted > 0) {
                log.info("Cache sweep completed: {} expired entries evicted, {} remaining", evicted, cache.size());
            } else {
                log.debug("Cache sweep completed: nothing to evict");
            }
            return evicted;
        } catch (RuntimeException e) {
            log.error("Cache sweep failed", e);
            return 0;
        }
    }

    /**
     * 내장 스케줄러로 주기적 정리 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                throw new IllegalStateException("CacheSweeper already started");
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "loadguard-cache-sweeper");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::sweep,
                config.sweepIntervalMs(), config.sweepIntervalMs(), TimeUnit.MILLISECONDS);
            log.info("CacheSweeper started with interval {}ms", config.sweepIntervalMs());
        }
    }

    /**
     * 주기적 정리 중지. 시작되지 않은 경우 아무 동작도 하지 않습니다.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void stop() throws InterruptedException {
        ScheduledExecutorService current;
        synchronized (lifecycleLock) {
            current = scheduler;
            scheduler = null;
        }
        if (current == null) {
            return;
        }
        current.shutdown();
        if (!current.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            current.shutdownNow();
        }
        log.info("CacheSweeper stopped");
    }

    /**
     * 내장 스케줄러 실행 여부.
     *
     * @return start() 이후 stop() 전이면 true
     */
    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return scheduler != null;
        }
    }
}
