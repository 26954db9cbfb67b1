package com.mike.leadscout.config;

import com.mike.leadscout.cache.CacheEntry;
import com.mike.leadscout.email.verify.LearnedPattern;
import com.mike.leadscout.listing.SourceYield;
import com.mike.leadscout.repository.CachedEmailRecordRepository;
import com.mike.leadscout.resilience.CircuitBreakerState;
import com.mike.leadscout.store.CaffeineKeyValueStore;
import com.mike.leadscout.store.JpaEmailCacheStore;
import com.mike.leadscout.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class StoreConfig {

    static final Duration CATCH_ALL_TTL = Duration.ofDays(7);
    static final Duration PATTERN_TTL = Duration.ofDays(30);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyValueStore<String, CacheEntry> emailStore(CacheProperties props, CachedEmailRecordRepository repository) {
        if (props.backend() == CacheProperties.Backend.JPA) {
            log.info("StoreConfig: email cache backed by JPA");
            return new JpaEmailCacheStore(repository);
        }
        log.info("StoreConfig: email cache in memory (maxEntries={})", props.maxEntries());
        return new CaffeineKeyValueStore<>(maxEntries(props), null);
    }

    @Bean
    public KeyValueStore<String, Boolean> catchAllStore(CacheProperties props) {
        return new CaffeineKeyValueStore<>(maxEntries(props), CATCH_ALL_TTL);
    }

    @Bean
    public KeyValueStore<String, LearnedPattern> patternStore(CacheProperties props) {
        return new CaffeineKeyValueStore<>(maxEntries(props), PATTERN_TTL);
    }

    @Bean
    public KeyValueStore<String, CircuitBreakerState> circuitStore() {
        return new CaffeineKeyValueStore<>(1_000, null);
    }

    @Bean
    public KeyValueStore<String, SourceYield> yieldStore() {
        return new CaffeineKeyValueStore<>(1_000, null);
    }

    private static long maxEntries(CacheProperties props) {
        return props.maxEntries() > 0 ? props.maxEntries() : 10_000;
    }
}
