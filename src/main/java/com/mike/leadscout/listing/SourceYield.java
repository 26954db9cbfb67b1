package com.mike.leadscout.listing;

/**
 * Historical productivity of a listing source.
 */
public record SourceYield(long calls, long listings) {

    public static SourceYield none() {
        return new SourceYield(0, 0);
    }

    public SourceYield plus(int returned) {
        return new SourceYield(calls + 1, listings + Math.max(0, returned));
    }

    public double listingsPerCall() {
        return calls == 0 ? 0.0 : (double) listings / calls;
    }
}
