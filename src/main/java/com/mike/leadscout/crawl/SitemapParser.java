package com.mike.leadscout.crawl;

import com.mike.leadscout.config.BrowserProperties;
import com.mike.leadscout.config.CascadeProperties;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads sitemap.xml (or a sitemap index) and returns page URLs whose path hints at contact details.
 */
@Component
@Slf4j
public class SitemapParser {

    static final List<String> SITEMAP_PATHS = List.of(
            "/sitemap.xml", "/sitemap_index.xml", "/sitemap-index.xml", "/sitemap1.xml"
    );

    static final List<String> CONTACT_KEYWORDS = List.of(
            "contact", "about", "team", "staff", "reach", "email", "get-in-touch",
            "connect", "location", "office", "support", "help", "info"
    );

    private static final int MAX_CHILD_SITEMAPS = 2;
    private static final int TIMEOUT_MS = 8_000;

    private final BrowserProperties browserProperties;
    private final int maxPages;

    public SitemapParser(BrowserProperties browserProperties, CascadeProperties cascadeProperties) {
        this.browserProperties = browserProperties;
        this.maxPages = cascadeProperties.getCrawl().getMaxSitemapPages();
    }

    public List<String> contactPages(String baseUrl) {
        Set<String> found = new LinkedHashSet<>();
        for (String path : SITEMAP_PATHS) {
            String sitemapUrl = SiteCrawler.resolve(baseUrl, path);
            Document doc = fetch(sitemapUrl);
            if (doc == null) continue;

            found.addAll(contactUrls(doc));
            if (!found.isEmpty()) break;

            List<String> children = childSitemaps(doc);
            for (String child : children.subList(0, Math.min(MAX_CHILD_SITEMAPS, children.size()))) {
                Document childDoc = fetch(child);
                if (childDoc != null) found.addAll(contactUrls(childDoc));
            }
            if (!found.isEmpty()) break;
        }

        List<String> out = new ArrayList<>(found);
        if (out.size() > maxPages) out = out.subList(0, maxPages);
        log.info("SitemapParser: {} -> {} contact-like pages", baseUrl, out.size());
        return List.copyOf(out);
    }

    static List<String> contactUrls(Document sitemap) {
        List<String> out = new ArrayList<>();
        for (Element loc : sitemap.select("url > loc")) {
            String url = loc.text().trim();
            if (isContactLike(url)) out.add(url);
        }
        return out;
    }

    static List<String> childSitemaps(Document sitemap) {
        List<String> out = new ArrayList<>();
        for (Element loc : sitemap.select("sitemap > loc")) {
            String url = loc.text().trim();
            if (!url.isEmpty()) out.add(url);
        }
        return out;
    }

    static boolean isContactLike(String url) {
        try {
            String path = URI.create(url).getPath();
            if (path == null) return false;
            String lower = path.toLowerCase(Locale.ROOT);
            return CONTACT_KEYWORDS.stream().anyMatch(lower::contains);
        } catch (IllegalArgumentException e) {
            log.debug("SitemapParser: skipping malformed loc {}", url);
            return false;
        }
    }

    private Document fetch(String url) {
        if (url == null) return null;
        try {
            Connection.Response res = Jsoup.connect(url)
                    .userAgent(browserProperties.effectiveUserAgent())
                    .timeout(TIMEOUT_MS)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .execute();
            if (res.statusCode() >= 400) return null;
            String body = res.body();
            String contentType = res.contentType() == null ? "" : res.contentType();
            if (!contentType.contains("xml") && !body.contains("<urlset") && !body.contains("<sitemapindex")) {
                return null;
            }
            return Jsoup.parse(body, url, Parser.xmlParser());
        } catch (IOException e) {
            log.debug("SitemapParser: cannot fetch {}: {}", url, e.getMessage());
            return null;
        }
    }
}
