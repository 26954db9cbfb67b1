package com.mike.leadscout.email.phase;

import com.mike.leadscout.crawl.CrawlState;
import com.mike.leadscout.crawl.SiteCrawler;
import com.mike.leadscout.crawl.SitemapParser;
import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class SitemapPhase implements CascadePhase {

    private final SitemapParser sitemapParser;
    private final SiteCrawler crawler;
    private final ConfidenceTable confidenceTable;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.SITEMAP;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return lookup.hasDomain() && lookup.getCrawlState().isEmpty();
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        List<String> pages = sitemapParser.contactPages(lookup.getBaseUrl());
        if (pages.isEmpty()) return null;

        CrawlState state = lookup.getCrawlState();
        crawler.visitAll(lookup.session(), pages, state);
        return CrawlCandidates.of(state.best(), phase(), confidenceTable);
    }
}
