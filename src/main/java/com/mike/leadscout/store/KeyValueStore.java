package com.mike.leadscout.store;

import java.util.Map;

/**
 * Process-wide state shared between workers (email cache, catch-all flags, learned patterns,
 * circuit-breaker state, source yields). Writes are last-write-wins.
 */
public interface KeyValueStore<K, V> {

    /**
     * @return the stored value or null when absent
     */
    V get(K key);

    void put(K key, V value);

    void remove(K key);

    Map<K, V> snapshot();
}
