package com.arco.gateway.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BoundedCache
 * Tests LRU eviction, recency updates and hit/miss accounting
 */
@DisplayName("BoundedCache Tests")
class BoundedCacheTest {

    private BoundedCache<String, Integer> cache;

    @BeforeEach
    void setUp() {
        cache = new BoundedCache<>(3);
    }

    @Test
    @DisplayName("Should reject non-positive capacity")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedCache<String, String>(0));
        assertThrows(IllegalArgumentException.class, () -> new BoundedCache<String, String>(-5));
    }

    @Nested
    @DisplayName("Eviction Tests")
    class EvictionTests {

        @Test
        @DisplayName("Should never exceed max size")
        void testCapacity() {
            for (int i = 0; i < 10; i++) {
                cache.set("k" + i, i);
                assertTrue(cache.size() <= 3, "Size must stay within capacity");
            }
            assertEquals(3, cache.size());
            assertEquals(List.of("k7", "k8", "k9"), cache.keys());
        }

        @Test
        @DisplayName("Should evict the least recently used key")
        void testLruRetention() {
            cache.set("a", 1);
            cache.set("b", 2);
            cache.set("c", 3);

            cache.get("a");        // a becomes MRU
            cache.set("d", 4);     // evicts b

            assertFalse(cache.containsKey("b"));
            assertEquals(List.of("c", "a", "d"), cache.keys());
        }

        @Test
        @DisplayName("Updating an existing key refreshes recency without eviction")
        void testUpdateExisting() {
            cache.set("a", 1);
            cache.set("b", 2);
            cache.set("c", 3);

            cache.set("a", 10);

            assertEquals(3, cache.size());
            assertEquals(Optional.of(10), cache.get("a"));
            assertEquals(List.of("b", "c", "a"), cache.keys());
        }

        @Test
        @DisplayName("containsKey should not change recency")
        void testContainsKeyIsPassive() {
            cache.set("a", 1);
            cache.set("b", 2);
            cache.set("c", 3);

            assertTrue(cache.containsKey("a"));
            cache.set("d", 4);

            assertFalse(cache.containsKey("a"), "a was still LRU and should be evicted");
            assertEquals(0, cache.getStats().hits());
        }
    }

    @Nested
    @DisplayName("Statistics Tests")
    class StatisticsTests {

        @Test
        @DisplayName("Should count hits and misses")
        void testHitMissAccounting() {
            cache.set("a", 1);

            cache.get("a");
            cache.get("a");
            cache.get("missing");

            BoundedCache.Stats stats = cache.getStats();
            assertEquals(2, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
            assertEquals(1, stats.size());
            assertEquals(3, stats.maxSize());
            assertEquals(1.0 / 3.0, stats.utilization(), 1e-9);
        }

        @Test
        @DisplayName("Empty cache has zero hit rate")
        void testEmptyStats() {
            BoundedCache.Stats stats = cache.getStats();
            assertEquals(0.0, stats.hitRate());
            assertEquals(0.0, stats.utilization());
        }

        @Test
        @DisplayName("clear() empties entries and resets counters")
        void testClear() {
            cache.set("a", 1);
            cache.get("a");
            cache.get("b");

            cache.clear();

            BoundedCache.Stats stats = cache.getStats();
            assertEquals(0, stats.size());
            assertEquals(0, stats.hits());
            assertEquals(0, stats.misses());
            assertTrue(cache.keys().isEmpty());
        }
    }

    @Test
    @DisplayName("Should reject null keys and values")
    void testNulls() {
        assertThrows(IllegalArgumentException.class, () -> cache.set(null, 1));
        assertThrows(IllegalArgumentException.class, () -> cache.set("a", null));
    }

    @Test
    @DisplayName("Should stay within capacity under concurrent writers")
    void testConcurrentWriters() throws InterruptedException {
        BoundedCache<Integer, Integer> shared = new BoundedCache<>(50);
        int threads = 8;
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            int offset = t * 1000;
            executor.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    shared.set(offset + i, i);
                    shared.get(offset + i / 2);
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(50, shared.size());
        assertEquals(50, shared.keys().size());
        assertEquals(threads * 500L, shared.getStats().hits() + shared.getStats().misses());
    }
}
