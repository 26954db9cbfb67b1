package com.mike.leadscout.email.phase;

import com.mike.leadscout.crawl.CrawlState;
import com.mike.leadscout.crawl.SiteCrawler;
import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Homepage and contact pages. Only a generic inbox ends the cascade here; weaker findings
 * are kept for the broader crawl.
 */
@Component
@RequiredArgsConstructor
public class WebsiteCrawlPhase implements CascadePhase {

    private final SiteCrawler crawler;
    private final ConfidenceTable confidenceTable;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.WEBSITE_CRAWL;
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        CrawlState state = lookup.getCrawlState();
        crawler.crawlContactPaths(lookup.session(), lookup.getBaseUrl(), state);
        if (!state.hasTopPriority()) return null;
        return CrawlCandidates.of(state.best(), phase(), confidenceTable);
    }
}
