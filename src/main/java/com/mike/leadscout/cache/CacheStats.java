package com.mike.leadscout.cache;

public record CacheStats(
        long hits,
        long misses,
        long errors,
        long entries
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
