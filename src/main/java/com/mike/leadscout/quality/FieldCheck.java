package com.mike.leadscout.quality;

import java.util.List;

/**
 * Validation outcome of one field: validity, a 0..1 score and the flags raised.
 */
public record FieldCheck(
        boolean valid,
        double score,
        List<String> flags
) {
    public static FieldCheck ok() {
        return new FieldCheck(true, 1.0, List.of());
    }

    public static FieldCheck of(boolean valid, double score, String flag) {
        return new FieldCheck(valid, score, List.of(flag));
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }
}
