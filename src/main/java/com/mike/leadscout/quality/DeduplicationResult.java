package com.mike.leadscout.quality;

import java.util.List;

public record DeduplicationResult(
        List<CanonicalBusiness> unique,
        List<DuplicateMatch> duplicates,
        DeduplicationStats stats
) {
}
