package com.mike.leadscout.quality;

import java.util.List;

public record SimilarityScore(
        double score,
        List<String> reasons
) {
}
