package com.mike.leadscout.cache;

import com.mike.leadscout.metrics.LeadScoutMetrics;
import com.mike.leadscout.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Domain -> best known email, with age tiers. Stale entries read as a miss but stay in the store
 * so a later run can overwrite them. Store failures never escape: they count as errors and misses.
 */
@Component
@Slf4j
public class EmailCache {

    private final KeyValueStore<String, CacheEntry> emailStore;
    private final KeyValueStore<String, Boolean> catchAllStore;
    private final LeadScoutMetrics metrics;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public EmailCache(@Qualifier("emailStore") KeyValueStore<String, CacheEntry> emailStore,
                      @Qualifier("catchAllStore") KeyValueStore<String, Boolean> catchAllStore,
                      LeadScoutMetrics metrics,
                      Clock clock) {
        this.emailStore = emailStore;
        this.catchAllStore = catchAllStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CacheLookup lookup(String domain) {
        String key = key(domain);
        if (key == null) return null;

        CacheEntry entry;
        try {
            entry = emailStore.get(key);
        } catch (RuntimeException e) {
            log.warn("EmailCache: lookup failed for domain={}: {}", key, e.getMessage());
            errors.incrementAndGet();
            metrics.cacheError();
            miss();
            return null;
        }

        if (entry == null || entry.email() == null) {
            miss();
            return null;
        }

        Freshness freshness = freshnessOf(entry);
        if (!freshness.isUsable()) {
            log.debug("EmailCache: stale entry for domain={}, cachedAt={}", key, entry.cachedAt());
            miss();
            return null;
        }

        hits.incrementAndGet();
        metrics.cacheLookup(true);
        return new CacheLookup(entry, freshness);
    }

    public void store(String domain, String email, double confidence, String source, boolean catchAll) {
        String key = key(domain);
        if (key == null || email == null) return;
        CacheEntry entry = new CacheEntry(key, email, confidence, source, catchAll, clock.instant());
        try {
            emailStore.put(key, entry);
            log.debug("EmailCache: stored {} for domain={} (confidence={}, source={})", email, key, confidence, source);
        } catch (RuntimeException e) {
            log.warn("EmailCache: store failed for domain={}: {}", key, e.getMessage());
            errors.incrementAndGet();
            metrics.cacheError();
        }
    }

    public void invalidate(String domain) {
        String key = key(domain);
        if (key == null) return;
        try {
            emailStore.remove(key);
        } catch (RuntimeException e) {
            log.warn("EmailCache: invalidate failed for domain={}: {}", key, e.getMessage());
            errors.incrementAndGet();
        }
    }

    /**
     * @return cached catch-all flag, or null when the domain has not been probed
     */
    public Boolean catchAll(String domain) {
        String key = key(domain);
        if (key == null) return null;
        try {
            return catchAllStore.get(key);
        } catch (RuntimeException e) {
            log.warn("EmailCache: catch-all lookup failed for domain={}: {}", key, e.getMessage());
            errors.incrementAndGet();
            return null;
        }
    }

    public void storeCatchAll(String domain, boolean catchAll) {
        String key = key(domain);
        if (key == null) return;
        try {
            catchAllStore.put(key, catchAll);
        } catch (RuntimeException e) {
            log.warn("EmailCache: catch-all store failed for domain={}: {}", key, e.getMessage());
            errors.incrementAndGet();
        }
    }

    public Freshness freshnessOf(CacheEntry entry) {
        Instant cachedAt = entry.cachedAt() == null ? Instant.EPOCH : entry.cachedAt();
        Duration age = Duration.between(cachedAt, clock.instant());
        if (age.isNegative()) age = Duration.ZERO;
        return Freshness.of(age);
    }

    public CacheStats stats() {
        long size;
        try {
            size = emailStore.snapshot().size();
        } catch (RuntimeException e) {
            log.warn("EmailCache: size unavailable: {}", e.getMessage());
            size = -1;
        }
        return new CacheStats(hits.get(), misses.get(), errors.get(), size);
    }

    public void resetStats() {
        hits.set(0);
        misses.set(0);
        errors.set(0);
    }

    private void miss() {
        misses.incrementAndGet();
        metrics.cacheLookup(false);
    }

    private static String key(String domain) {
        if (domain == null || domain.isBlank()) return null;
        return domain.trim().toLowerCase(Locale.ROOT);
    }
}
