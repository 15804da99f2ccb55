package com.ryuqq.loadguard.adapter.inmemory.store;

import com.ryuqq.loadguard.core.admission.TokenBucket;
import com.ryuqq.loadguard.core.spi.BucketStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of {@link BucketStore} SPI.
 *
 * <p>Buckets are kept in a {@link ConcurrentHashMap}; {@link ConcurrentHashMap#computeIfAbsent}
 * guarantees that the factory runs at most once per key, so every caller shares the same
 * {@link TokenBucket} instance and therefore the same per-key lock.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Buckets are never evicted automatically; callers remove idle keys explicitly</li>
 *   <li>State is local to the process</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public class InMemoryBucketStore implements BucketStore {

    private final ConcurrentHashMap<String, TokenBucket> buckets;

    /**
     * Creates a new InMemoryBucketStore with empty storage.
     */
    public InMemoryBucketStore() {
        this.buckets = new ConcurrentHashMap<>();
    }

    @Override
    public TokenBucket getOrCreate(String key, Function<String, TokenBucket> factory) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }

        TokenBucket bucket = buckets.computeIfAbsent(key, factory);
        if (bucket == null) {
            throw new IllegalStateException("factory returned null for key: " + key);
        }
        return bucket;
    }

    @Override
    public Optional<TokenBucket> find(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(buckets.get(key));
    }

    @Override
    public boolean remove(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return buckets.remove(key) != null;
    }

    @Override
    public int size() {
        return buckets.size();
    }

    @Override
    public void clear() {
        buckets.clear();
    }
}
