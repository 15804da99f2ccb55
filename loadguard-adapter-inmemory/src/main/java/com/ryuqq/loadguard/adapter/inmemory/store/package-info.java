/**
 * In-memory Store adapter implementation package.
 *
 * <p>This package provides {@link java.util.concurrent.ConcurrentHashMap}-backed reference
 * implementations of the store SPIs.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.loadguard.adapter.inmemory.store.InMemoryBucketStore}:
 *       per-key token buckets for {@link com.ryuqq.loadguard.core.spi.BucketStore}</li>
 *   <li>{@link com.ryuqq.loadguard.adapter.inmemory.store.InMemoryCacheStore}:
 *       cache entries for {@link com.ryuqq.loadguard.core.spi.CacheStore}</li>
 *   <li>{@link com.ryuqq.loadguard.adapter.inmemory.store.InMemoryTaskStore}:
 *       task snapshots for {@link com.ryuqq.loadguard.core.spi.TaskStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared across instances of a horizontally scaled service</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.adapter.inmemory.store;
