package com.mike.leadscout.email.extract;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drops addresses that are never a business contact: platform and free-mail domains,
 * placeholders, no-reply boxes and asset file names that look like addresses.
 */
public final class EmailFilter {

    static final Set<String> SKIP_DOMAINS = Set.of(
            "example.com", "sentry.io", "wixpress.com", "wix.com", "squarespace.com",
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "aol.com", "googlemail.com",
            "mail.com", "email.com", "test.com", "domain.com", "yoursite.com", "yourdomain.com",
            "company.com", "website.com", "sentry-next.wixpress.com", "godaddy.com"
    );

    static final Set<String> SKIP_LOCAL_PARTS = Set.of(
            "test", "example", "user", "email", "your", "name", "yourname", "admin", "webmaster",
            "noreply", "no-reply", "donotreply", "do-not-reply", "firstname", "john.doe", "jane.doe"
    );

    private static final List<String> ASSET_SUFFIXES = List.of(
            ".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp", ".css", ".js", ".ico", ".bmp", ".tiff", ".woff", ".woff2"
    );

    private static final Pattern HEX_LOCAL_PART = Pattern.compile("^[0-9a-f]{16,}$");

    public static final Set<String> GENERIC_PROVIDERS = Set.of(
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "aol.com", "icloud.com",
            "googlemail.com", "live.com", "msn.com", "mail.com", "protonmail.com", "ymail.com", "me.com"
    );

    private EmailFilter() {
    }

    public static boolean isAcceptable(String email) {
        if (email == null) return false;
        String e = email.toLowerCase(Locale.ROOT);
        int at = e.lastIndexOf('@');
        if (at <= 0) return false;

        String local = e.substring(0, at);
        String domain = e.substring(at + 1);

        if (SKIP_DOMAINS.contains(domain)) return false;
        if (SKIP_DOMAINS.stream().anyMatch(d -> domain.endsWith("." + d))) return false;
        if (SKIP_LOCAL_PARTS.contains(local)) return false;
        if (ASSET_SUFFIXES.stream().anyMatch(e::endsWith)) return false;
        return !HEX_LOCAL_PART.matcher(local).matches();
    }

    public static boolean isGenericProvider(String email) {
        if (email == null) return false;
        int at = email.lastIndexOf('@');
        return at >= 0 && GENERIC_PROVIDERS.contains(email.substring(at + 1).toLowerCase(Locale.ROOT));
    }
}
