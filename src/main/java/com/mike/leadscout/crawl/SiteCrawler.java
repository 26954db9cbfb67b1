package com.mike.leadscout.crawl;

import com.mike.leadscout.browser.BrowserSession;
import com.mike.leadscout.browser.PageSnapshot;
import com.mike.leadscout.config.CascadeProperties;
import com.mike.leadscout.email.extract.EmailHarvester;
import com.mike.leadscout.email.extract.HarvestedEmail;
import com.mike.leadscout.resilience.LeadScoutException;
import com.mike.leadscout.util.Domains;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks a business website page by page through a {@link BrowserSession}, feeding every page
 * to the {@link EmailHarvester} and recording findings, kept pages and social links in a {@link CrawlState}.
 */
@Component
@Slf4j
public class SiteCrawler {

    static final List<String> CONTACT_PATHS = List.of(
            "/", "/contact", "/contact-us", "/contactus", "/about", "/about-us", "/aboutus",
            "/team", "/our-team", "/staff", "/meet-the-team", "/meet-us", "/get-in-touch",
            "/reach-us", "/connect", "/location", "/locations", "/office", "/info", "/support", "/help"
    );

    static final List<String> CONTACT_KEYWORDS = List.of(
            "contact", "about", "team", "staff", "reach", "email", "get-in-touch", "connect"
    );

    private static final List<String> DOCUMENT_SUFFIXES = List.of(".txt", ".vcf");
    private static final int MAX_DOCUMENTS = 3;
    private static final int TOP_PRIORITY_TARGET = 2;

    private final EmailHarvester harvester;
    private final CascadeProperties.Crawl props;

    public SiteCrawler(EmailHarvester harvester, CascadeProperties cascadeProperties) {
        this.harvester = harvester;
        this.props = cascadeProperties.getCrawl();
    }

    /**
     * Homepage, then contact-like pages linked from it, then the well-known contact paths,
     * plus contact links found along the way. Stops once two generic inboxes are known.
     */
    public void crawlContactPaths(BrowserSession session, String baseUrl, CrawlState state) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> queued = new LinkedHashSet<>();

        PageSnapshot home = visit(session, baseUrl, state);
        if (home != null) {
            List<String> discovered = contactLinks(home, baseUrl);
            for (int i = discovered.size() - 1; i >= 0; i--) {
                if (queued.add(discovered.get(i))) queue.addFirst(discovered.get(i));
            }
            visitDocuments(session, home, baseUrl, state);
        }
        for (String path : CONTACT_PATHS) {
            String url = resolve(baseUrl, path);
            if (url != null && queued.add(url)) queue.addLast(url);
        }

        int checked = 0;
        while (!queue.isEmpty() && checked < props.getMaxContactPaths()) {
            if (state.topPriorityCount() >= TOP_PRIORITY_TARGET) break;
            String url = queue.pollFirst();
            if (state.isVisited(url)) continue;
            checked++;

            PageSnapshot page = visit(session, url, state);
            if (page == null) continue;

            if (queued.size() < props.getMaxContactPaths()) {
                contactLinks(page, baseUrl).stream()
                        .filter(link -> !state.isVisited(link) && queued.add(link))
                        .limit(props.getInternalLinksPerPage())
                        .forEach(queue::addLast);
            }
        }
        log.info("SiteCrawler: {} -> {} pages visited, {} addresses", baseUrl, state.visitedCount(), state.findings().size());
    }

    /**
     * Breadth-first walk over same-site links, contact-like links first, bounded by the page budget.
     * Stops as soon as a generic inbox is known.
     */
    public void crawlSite(BrowserSession session, String baseUrl, CrawlState state) {
        Deque<String> queue = new ArrayDeque<>();
        queue.add(baseUrl);
        Set<String> queued = new LinkedHashSet<>(queue);
        int budget = props.getPageBudget();
        int visitedHere = 0;

        while (!queue.isEmpty() && visitedHere < budget && !state.hasTopPriority()) {
            String url = queue.pollFirst();
            PageSnapshot page = state.isVisited(url) ? null : visit(session, url, state);
            if (page != null) visitedHere++;

            PageSnapshot source = page;
            if (source == null && url.equals(baseUrl)) {
                source = state.pages().isEmpty() ? null : state.pages().get(0);
            }
            if (source == null) continue;

            List<String> contact = new ArrayList<>();
            List<String> other = new ArrayList<>();
            for (String link : sameSiteLinks(source, baseUrl)) {
                if (state.isVisited(link) || !queued.add(link)) continue;
                if (looksLikeContact(link, "")) contact.add(link);
                else other.add(link);
            }
            for (int i = contact.size() - 1; i >= 0; i--) queue.addFirst(contact.get(i));
            queue.addAll(other);
        }
        log.info("SiteCrawler: broad crawl of {} visited {} new pages, {} addresses", baseUrl, visitedHere, state.findings().size());
    }

    /**
     * Visits the given URLs in order, stopping once a generic inbox is known.
     */
    public void visitAll(BrowserSession session, List<String> urls, CrawlState state) {
        for (String url : urls) {
            if (state.hasTopPriority()) break;
            if (state.isVisited(url)) continue;
            visit(session, url, state);
        }
    }

    PageSnapshot visit(BrowserSession session, String url, CrawlState state) {
        if (url == null || !state.markVisited(url)) return null;
        try {
            if (!session.navigate(url, pageTimeout())) {
                log.debug("SiteCrawler: {} answered with an error status", url);
                return null;
            }
            PageSnapshot page = session.snapshot();
            for (HarvestedEmail email : harvester.harvest(page)) {
                state.record(email, page.url());
            }
            collectSocialLinks(page, state);
            state.keepPage(page);
            return page;
        } catch (LeadScoutException e) {
            log.debug("SiteCrawler: cannot load {}: {}", url, e.getMessage());
            return null;
        }
    }

    private void visitDocuments(BrowserSession session, PageSnapshot page, String baseUrl, CrawlState state) {
        int fetched = 0;
        for (String link : sameSiteLinks(page, baseUrl)) {
            if (fetched >= MAX_DOCUMENTS) break;
            String lower = link.toLowerCase(Locale.ROOT);
            if (DOCUMENT_SUFFIXES.stream().noneMatch(lower::endsWith)) continue;
            if (!state.markVisited(link)) continue;
            fetched++;
            try {
                if (session.navigate(link, pageTimeout())) {
                    String text = session.renderedText();
                    if (text == null || text.isBlank()) text = session.content();
                    for (HarvestedEmail email : harvester.harvestText(text)) {
                        state.record(email, link);
                    }
                }
            } catch (LeadScoutException e) {
                log.debug("SiteCrawler: cannot load document {}: {}", link, e.getMessage());
            }
        }
    }

    private static void collectSocialLinks(PageSnapshot page, CrawlState state) {
        for (Element a : page.document().select("a[href]")) {
            String href = a.absUrl("href");
            if (href.isBlank() || !SocialPlatform.isProfileLink(href)) continue;
            state.addSocialLink(SocialPlatform.of(href).key(), href);
        }
    }

    static List<String> contactLinks(PageSnapshot page, String baseUrl) {
        Set<String> out = new LinkedHashSet<>();
        for (Element a : page.document().select("a[href]")) {
            String abs = a.absUrl("href");
            if (abs.isBlank() || !abs.startsWith("http") || !Domains.isSameDomain(baseUrl, abs)) continue;
            if (looksLikeContact(a.attr("href"), a.text())) {
                out.add(stripFragment(abs));
            }
        }
        return new ArrayList<>(out);
    }

    static List<String> sameSiteLinks(PageSnapshot page, String baseUrl) {
        Set<String> out = new LinkedHashSet<>();
        for (Element a : page.document().select("a[href]")) {
            String abs = a.absUrl("href");
            if (abs.isBlank() || !abs.startsWith("http")) continue;
            if (!Domains.isSameDomain(baseUrl, abs)) continue;
            out.add(stripFragment(abs));
        }
        return new ArrayList<>(out);
    }

    static boolean looksLikeContact(String href, String text) {
        String h = href == null ? "" : href.toLowerCase(Locale.ROOT);
        String t = text == null ? "" : text.toLowerCase(Locale.ROOT);
        return CONTACT_KEYWORDS.stream().anyMatch(k -> h.contains(k) || t.contains(k));
    }

    static String resolve(String baseUrl, String path) {
        try {
            return URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/").resolve(path.startsWith("/") ? path.substring(1) : path).toString();
        } catch (IllegalArgumentException e) {
            log.debug("SiteCrawler: cannot resolve {} against {}", path, baseUrl);
            return null;
        }
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    private Duration pageTimeout() {
        return props.getPageTimeout() == null ? Duration.ofSeconds(15) : props.getPageTimeout();
    }
}
