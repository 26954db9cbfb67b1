package com.mike.leadscout.crawl;

/**
 * @param onDomain whether the address belongs to the crawled site's domain
 */
public record CrawlFinding(
        String email,
        int priority,
        String pageUrl,
        boolean onDomain
) {
}
