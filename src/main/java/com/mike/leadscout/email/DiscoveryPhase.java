package com.mike.leadscout.email;

import java.util.Locale;

/**
 * Cascade phases in the order they are tried.
 */
public enum DiscoveryPhase {
    CACHE,
    CONTACT_API,
    WEBSITE_CRAWL,
    SITE_CRAWL,
    SITEMAP,
    SOCIAL,
    WEB_SEARCH,
    LICENSING_BOARD,
    NAME_PERMUTATION,
    DOMAIN_RECORD,
    GENERATED;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
