package com.mike.leadscout.quality;

public record DuplicateMatch(
        RawListing listing,
        String mergedInto,
        double similarity
) {
}
