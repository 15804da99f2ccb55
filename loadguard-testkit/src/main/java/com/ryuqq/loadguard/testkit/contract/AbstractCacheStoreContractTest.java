package com.ryuqq.loadguard.testkit.contract;

import com.ryuqq.loadguard.core.cache.CacheEntry;
import com.ryuqq.loadguard.core.model.Fingerprint;
import com.ryuqq.loadguard.core.spi.CacheStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CacheStore} implementations.
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public abstract class AbstractCacheStoreContractTest {

    protected CacheStore<String> store;

    /**
     * Creates a fresh, empty store for each test.
     *
     * @return store under test
     */
    protected abstract CacheStore<String> createStore();

    @BeforeEach
    public void setUpStore() {
        store = createStore();
    }

    @AfterEach
    public void tearDownStore() {
        if (store != null) {
            store.clear();
        }
    }

    @Test
    public void put_후_get은_같은_엔트리() {
        // given
        Fingerprint fp = Fingerprint.of("fp-1");
        CacheEntry<String> entry = new CacheEntry<>("value", 100L);

        // when
        store.put(fp, entry);

        // then
        assertEquals(entry, store.get(fp).orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    public void get은_만료된_엔트리도_그대로_반환() {
        // given
        Fingerprint fp = Fingerprint.of("fp-1");
        store.put(fp, new CacheEntry<>("stale", -1L));

        // then
        assertTrue(store.get(fp).isPresent());
    }

    @Test
    public void put은_기존_엔트리를_덮어씀() {
        // given
        Fingerprint fp = Fingerprint.of("fp-1");
        store.put(fp, new CacheEntry<>("old", 1L));

        // when
        store.put(fp, new CacheEntry<>("new", 2L));

        // then
        assertEquals("new", store.get(fp).orElseThrow().value());
        assertEquals(1, store.size());
    }

    @Test
    public void removeIfSame은_교체된_엔트리를_지우지_않음() {
        // given
        Fingerprint fp = Fingerprint.of("fp-1");
        CacheEntry<String> stale = new CacheEntry<>("stale", 1L);
        CacheEntry<String> fresh = new CacheEntry<>("fresh", 1_000L);
        store.put(fp, stale);
        store.put(fp, fresh);

        // when
        boolean removed = store.removeIfSame(fp, stale);

        // then
        assertFalse(removed);
        assertEquals("fresh", store.get(fp).orElseThrow().value());

        assertTrue(store.removeIfSame(fp, fresh));
        assertTrue(store.get(fp).isEmpty());
    }

    @Test
    public void removeExpired는_만료된_엔트리만_제거() {
        // given
        store.put(Fingerprint.of("expired-1"), new CacheEntry<>("a", 10L));
        store.put(Fingerprint.of("expired-2"), new CacheEntry<>("b", 50L));
        store.put(Fingerprint.of("fresh"), new CacheEntry<>("c", 200L));

        // when
        int removed = store.removeExpired(100L);

        // then
        assertEquals(2, removed);
        assertEquals(1, store.size());
        assertTrue(store.get(Fingerprint.of("fresh")).isPresent());
    }

    @Test
    public void remove_결과_반환() {
        // given
        Fingerprint fp = Fingerprint.of("fp-1");
        store.put(fp, new CacheEntry<>("value", 1L));

        // then
        assertTrue(store.remove(fp));
        assertFalse(store.remove(fp));
    }

    @Test
    public void null_인자는_거부() {
        assertThrows(IllegalArgumentException.class, () -> store.get(null));
        assertThrows(IllegalArgumentException.class, () -> store.put(Fingerprint.of("fp"), null));
    }
}
