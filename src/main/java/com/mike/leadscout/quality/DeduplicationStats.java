package com.mike.leadscout.quality;

import java.util.Map;

public record DeduplicationStats(
        int total,
        int unique,
        int duplicates,
        Map<String, Integer> bySource
) {
}
