package com.ryuqq.loadguard.adapter.inmemory.store;

import com.ryuqq.loadguard.core.cache.CacheEntry;
import com.ryuqq.loadguard.core.model.Fingerprint;
import com.ryuqq.loadguard.core.spi.CacheStore;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CacheStore} SPI.
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get / put / remove:</strong> O(1)</li>
 *   <li><strong>removeIfSame:</strong> O(1), atomic via {@link ConcurrentHashMap#remove(Object, Object)}</li>
 *   <li><strong>removeExpired:</strong> O(N) weakly consistent iteration</li>
 * </ul>
 *
 * <p>{@link CacheEntry} is a record, so {@code removeIfSame} compares by value; two entries with the
 * same value and expiry are interchangeable for eviction purposes.</p>
 *
 * @param <V> value type
 * @author LoadGuard Team
 * @since 1.0.0
 */
public class InMemoryCacheStore<V> implements CacheStore<V> {

    private final ConcurrentHashMap<Fingerprint, CacheEntry<V>> entries;

    /**
     * Creates a new InMemoryCacheStore with empty storage.
     */
    public InMemoryCacheStore() {
        this.entries = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<CacheEntry<V>> get(Fingerprint fingerprint) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public void put(Fingerprint fingerprint, CacheEntry<V> entry) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.put(fingerprint, entry);
    }

    @Override
    public boolean remove(Fingerprint fingerprint) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        return entries.remove(fingerprint) != null;
    }

    @Override
    public boolean removeIfSame(Fingerprint fingerprint, CacheEntry<V> expected) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        return entries.remove(fingerprint, expected);
    }

    @Override
    public int removeExpired(long nowNanos) {
        int removed = 0;
        Iterator<Map.Entry<Fingerprint, CacheEntry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Fingerprint, CacheEntry<V>> next = iterator.next();
            CacheEntry<V> entry = next.getValue();
            // 반복 중 교체된 fresh 엔트리를 지우지 않도록 조건부 제거
            if (entry.isExpired(nowNanos) && entries.remove(next.getKey(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }
}
