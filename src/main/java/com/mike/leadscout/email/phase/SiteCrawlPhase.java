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
 * Bounded walk over the rest of the site when the contact pages gave no generic inbox.
 * Returns the best address crawled so far, whatever its priority.
 */
@Component
@RequiredArgsConstructor
public class SiteCrawlPhase implements CascadePhase {

    private final SiteCrawler crawler;
    private final ConfidenceTable confidenceTable;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.SITE_CRAWL;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return lookup.hasDomain() && !lookup.getCrawlState().hasTopPriority();
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        CrawlState state = lookup.getCrawlState();
        crawler.crawlSite(lookup.session(), lookup.getBaseUrl(), state);
        return CrawlCandidates.of(state.best(), phase(), confidenceTable);
    }
}
