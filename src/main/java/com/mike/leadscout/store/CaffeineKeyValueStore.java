package com.mike.leadscout.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Map;

public class CaffeineKeyValueStore<K, V> implements KeyValueStore<K, V> {

    private final Cache<K, V> cache;

    public CaffeineKeyValueStore(long maximumSize, Duration expireAfterWrite) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maximumSize);
        if (expireAfterWrite != null) {
            builder.expireAfterWrite(expireAfterWrite);
        }
        this.cache = builder.build();
    }

    public static <K, V> CaffeineKeyValueStore<K, V> inMemory() {
        return new CaffeineKeyValueStore<>(10_000, null);
    }

    @Override
    public V get(K key) {
        if (key == null) return null;
        return cache.getIfPresent(key);
    }

    @Override
    public void put(K key, V value) {
        if (key == null) return;
        if (value == null) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, value);
    }

    @Override
    public void remove(K key) {
        if (key == null) return;
        cache.invalidate(key);
    }

    @Override
    public Map<K, V> snapshot() {
        return Map.copyOf(cache.asMap());
    }
}
