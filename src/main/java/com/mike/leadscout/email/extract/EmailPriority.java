package com.mike.leadscout.email.extract;

import java.util.Locale;
import java.util.Set;

/**
 * 1 = generic business inbox, 2 = departmental, 3 = anything else (usually a person).
 */
public final class EmailPriority {

    public static final int GENERIC = 1;
    public static final int DEPARTMENTAL = 2;
    public static final int OTHER = 3;

    static final Set<String> GENERIC_PREFIXES = Set.of(
            "info", "contact", "hello", "office", "mail", "enquiries", "inquiries", "appointments", "schedule", "booking"
    );

    static final Set<String> DEPARTMENTAL_PREFIXES = Set.of(
            "support", "help", "service", "sales", "admin", "reception", "frontdesk", "billing"
    );

    private EmailPriority() {
    }

    public static int of(String email) {
        if (email == null) return OTHER;
        int at = email.indexOf('@');
        String local = (at > 0 ? email.substring(0, at) : email).toLowerCase(Locale.ROOT);
        if (GENERIC_PREFIXES.contains(local)) return GENERIC;
        if (DEPARTMENTAL_PREFIXES.contains(local)) return DEPARTMENTAL;
        return OTHER;
    }
}
