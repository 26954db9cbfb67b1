package com.mike.leadscout.cache;

import com.mike.leadscout.metrics.LeadScoutMetrics;
import com.mike.leadscout.store.CaffeineKeyValueStore;
import com.mike.leadscout.store.KeyValueStore;
import com.mike.leadscout.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailCacheTest {

    private MutableClock clock;
    private KeyValueStore<String, CacheEntry> emailStore;
    private LeadScoutMetrics metrics;
    private EmailCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        emailStore = CaffeineKeyValueStore.inMemory();
        metrics = mock(LeadScoutMetrics.class);
        cache = new EmailCache(emailStore, CaffeineKeyValueStore.inMemory(), metrics, clock);
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("stored entry -> fresh hit, key case-insensitive")
        void lookup_fresh_hit() {
            //Arrange
            cache.store("SmithDental.com", "info@smithdental.com", 0.9, "website-crawl:/contact", false);
            //Act
            CacheLookup result = cache.lookup("smithdental.com");
            //Assert
            assertNotNull(result);
            assertEquals("info@smithdental.com", result.entry().email());
            assertEquals(Freshness.FRESH, result.freshness());
            assertFalse(result.shouldReverify());
            verify(metrics).cacheLookup(true);
        }

        @Test
        @DisplayName("8 days old -> aging hit that asks for re-verification")
        void lookup_aging() {
            //Arrange
            cache.store("smithdental.com", "info@smithdental.com", 0.9, "website-crawl", false);
            clock.advance(Duration.ofDays(8));
            //Act
            CacheLookup result = cache.lookup("smithdental.com");
            //Assert
            assertNotNull(result);
            assertEquals(Freshness.AGING, result.freshness());
            assertTrue(result.shouldReverify());
            assertEquals(0.7, result.freshnessScore());
        }

        @Test
        @DisplayName("30 days old -> miss, entry kept")
        void lookup_stale_is_miss_but_kept() {
            //Arrange
            cache.store("smithdental.com", "info@smithdental.com", 0.9, "website-crawl", false);
            clock.advance(Duration.ofDays(30));
            //Act
            CacheLookup result = cache.lookup("smithdental.com");
            //Assert
            assertNull(result);
            assertNotNull(emailStore.get("smithdental.com"));
        }

        @Test
        @DisplayName("unknown domain -> miss")
        void lookup_miss() {
            //Act
            CacheLookup result = cache.lookup("unknown.com");
            //Assert
            assertNull(result);
            verify(metrics).cacheLookup(false);
        }

        @Test
        @DisplayName("null domain -> null, not counted")
        void lookup_null_domain() {
            //Act
            CacheLookup result = cache.lookup(null);
            //Assert
            assertNull(result);
            assertEquals(0, cache.stats().misses());
        }
    }

    @Test
    @DisplayName("stats: hits, misses, hit rate")
    void stats_hit_rate() {
        //Arrange
        cache.store("a.com", "info@a.com", 0.9, "website-crawl", false);
        cache.lookup("a.com");
        cache.lookup("a.com");
        cache.lookup("b.com");
        cache.lookup("c.com");
        //Act
        CacheStats stats = cache.stats();
        //Assert
        assertEquals(2, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(0.5, stats.hitRate());
        assertEquals(1, stats.entries());
    }

    @Test
    @DisplayName("store failure -> counted as error, not thrown")
    @SuppressWarnings("unchecked")
    void store_failure_is_counted() {
        //Arrange
        KeyValueStore<String, CacheEntry> failing = mock(KeyValueStore.class);
        doThrow(new IllegalStateException("db down")).when(failing).put(any(), any());
        when(failing.get(any())).thenThrow(new IllegalStateException("db down"));
        EmailCache broken = new EmailCache(failing, CaffeineKeyValueStore.inMemory(), metrics, clock);
        //Act
        broken.store("a.com", "info@a.com", 0.9, "website-crawl", false);
        CacheLookup result = broken.lookup("a.com");
        //Assert
        assertNull(result);
        assertEquals(2, broken.stats().errors());
        assertEquals(1, broken.stats().misses());
    }

    @Test
    @DisplayName("invalidate removes the entry")
    void invalidate_removes() {
        //Arrange
        cache.store("a.com", "info@a.com", 0.9, "website-crawl", false);
        //Act
        cache.invalidate("a.com");
        //Assert
        assertNull(cache.lookup("a.com"));
    }

    @Test
    @DisplayName("catch-all flag: unknown -> null, stored -> value")
    void catch_all_flag() {
        //Act
        Boolean before = cache.catchAll("a.com");
        cache.storeCatchAll("a.com", true);
        //Assert
        assertNull(before);
        assertEquals(Boolean.TRUE, cache.catchAll("A.com"));
    }
}
