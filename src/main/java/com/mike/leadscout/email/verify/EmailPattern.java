package com.mike.leadscout.email.verify;

import java.util.function.BinaryOperator;

/**
 * Local-part conventions for personal addresses, applied to sanitized lower-case first and last names.
 */
public enum EmailPattern {
    FIRST_DOT_LAST("first.last", (f, l) -> f + "." + l),
    FIRSTLAST("firstlast", (f, l) -> f + l),
    FIRST_UNDERSCORE_LAST("first_last", (f, l) -> f + "_" + l),
    FLAST("flast", (f, l) -> f.charAt(0) + l),
    FIRSTL("firstl", (f, l) -> f + l.charAt(0)),
    F_DOT_LAST("f.last", (f, l) -> f.charAt(0) + "." + l),
    FIRST("first", (f, l) -> f),
    LAST("last", (f, l) -> l),
    LASTFIRST("lastfirst", (f, l) -> l + f),
    LAST_DOT_FIRST("last.first", (f, l) -> l + "." + f),
    LASTF("lastf", (f, l) -> l + f.charAt(0)),
    FL("fl", (f, l) -> "" + f.charAt(0) + l.charAt(0));

    private final String label;
    private final BinaryOperator<String> format;

    EmailPattern(String label, BinaryOperator<String> format) {
        this.label = label;
        this.format = format;
    }

    public String label() {
        return label;
    }

    /**
     * @return the local part, or null when either name is empty
     */
    public String apply(String first, String last) {
        if (first == null || last == null || first.isEmpty() || last.isEmpty()) return null;
        return format.apply(first, last);
    }
}
