package com.mike.leadscout.crawl;

import com.mike.leadscout.browser.PageSnapshot;
import com.mike.leadscout.email.extract.EmailPriority;
import com.mike.leadscout.email.extract.HarvestedEmail;
import com.mike.leadscout.util.Domains;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * What the crawl phases of one cascade run have seen so far. Owned by a single worker.
 */
public class CrawlState {

    static final int MAX_KEPT_PAGES = 12;

    private final String domain;
    private final Set<String> visited = new HashSet<>();
    private final Map<String, CrawlFinding> findings = new LinkedHashMap<>();
    private final List<PageSnapshot> pages = new ArrayList<>();
    private final Map<String, String> socialLinks = new LinkedHashMap<>();

    public CrawlState(String domain) {
        this.domain = domain;
    }

    public String domain() {
        return domain;
    }

    /**
     * @return false when the URL was already visited
     */
    public boolean markVisited(String url) {
        return visited.add(visitKey(url));
    }

    public boolean isVisited(String url) {
        return visited.contains(visitKey(url));
    }

    public int visitedCount() {
        return visited.size();
    }

    public void record(HarvestedEmail harvested, String pageUrl) {
        boolean onDomain = domain != null && Domains.emailMatchesDomain(harvested.email(), domain);
        CrawlFinding finding = new CrawlFinding(harvested.email(), harvested.priority(), pageUrl, onDomain);
        CrawlFinding existing = findings.get(harvested.email());
        if (existing == null || existing.priority() > finding.priority()) {
            findings.put(harvested.email(), finding);
        }
    }

    public void keepPage(PageSnapshot page) {
        if (pages.size() < MAX_KEPT_PAGES) pages.add(page);
    }

    public void addSocialLink(String platform, String url) {
        socialLinks.putIfAbsent(platform, url);
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    public long topPriorityCount() {
        return findings.values().stream().filter(f -> f.priority() == EmailPriority.GENERIC).count();
    }

    public boolean hasTopPriority() {
        return topPriorityCount() > 0;
    }

    /**
     * On-domain before off-domain, then by priority, then by discovery order.
     */
    public CrawlFinding best() {
        return findings.values().stream()
                .min(Comparator.comparing((CrawlFinding f) -> !f.onDomain())
                        .thenComparingInt(CrawlFinding::priority))
                .orElse(null);
    }

    public List<CrawlFinding> findings() {
        return List.copyOf(findings.values());
    }

    public List<PageSnapshot> pages() {
        return List.copyOf(pages);
    }

    public Map<String, String> socialLinks() {
        return Map.copyOf(socialLinks);
    }

    private static String visitKey(String url) {
        if (url == null) return "";
        String s = url.trim().toLowerCase(Locale.ROOT);
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s.replaceFirst("^https?://(www\\.)?", "");
    }
}
