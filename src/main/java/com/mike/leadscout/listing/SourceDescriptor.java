package com.mike.leadscout.listing;

/**
 * @param priority   1 runs first
 * @param parallel   may run concurrently with the other parallel sources of its group
 * @param minResults skip once this many listings are already collected; 0 = never skip
 */
public record SourceDescriptor(
        String sourceId,
        int priority,
        boolean parallel,
        int minResults
) {
    static SourceDescriptor first(String sourceId) {
        return new SourceDescriptor(sourceId, 1, true, 0);
    }

    static SourceDescriptor later(String sourceId, int priority, boolean parallel, int minResults) {
        return new SourceDescriptor(sourceId, priority, parallel, minResults);
    }

    public boolean isWanted(int collected) {
        return minResults <= 0 || collected < minResults;
    }
}
