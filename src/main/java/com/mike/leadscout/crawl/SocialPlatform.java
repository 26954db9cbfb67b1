package com.mike.leadscout.crawl;

import com.mike.leadscout.util.Domains;

import java.util.Locale;

/**
 * Social networks a business profile may publish an address on, in the order they are tried.
 */
public enum SocialPlatform {
    FACEBOOK("facebook.com", "/about"),
    INSTAGRAM("instagram.com", ""),
    LINKEDIN("linkedin.com", "/about");

    private final String host;
    private final String aboutSuffix;

    SocialPlatform(String host, String aboutSuffix) {
        this.host = host;
        this.aboutSuffix = aboutSuffix;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SocialPlatform of(String url) {
        String domain = Domains.extractDomain(url);
        if (domain == null) return null;
        for (SocialPlatform p : values()) {
            if (domain.equals(p.host) || domain.endsWith("." + p.host)) return p;
        }
        return null;
    }

    /**
     * Share buttons and tracking pixels point at the network, not at a profile.
     */
    public static boolean isProfileLink(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        return of(u) != null
                && !u.contains("sharer")
                && !u.contains("/share")
                && !u.contains("/intent")
                && !u.contains("/tr?")
                && !u.contains("/plugins/");
    }

    public String aboutUrl(String profileUrl) {
        String base = profileUrl.trim();
        int q = base.indexOf('?');
        if (q >= 0) base = base.substring(0, q);
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        if (aboutSuffix.isEmpty() || base.endsWith(aboutSuffix)) return base;
        return base + aboutSuffix;
    }
}
