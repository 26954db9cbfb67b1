package com.mike.leadscout.email.phase;

import com.mike.leadscout.crawl.CrawlFinding;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.Evidence;

import java.net.URI;

final class CrawlCandidates {

    private CrawlCandidates() {
    }

    static EmailCandidate of(CrawlFinding finding, DiscoveryPhase phase, ConfidenceTable table) {
        if (finding == null) return null;
        double confidence = table.crawlConfidence(phase, finding.priority(), finding.onDomain());
        return EmailCandidate.of(finding.email(), confidence, phase, Evidence.DISCOVERED, pathOf(finding.pageUrl()));
    }

    private static String pathOf(String url) {
        if (url == null) return null;
        try {
            String path = URI.create(url).getPath();
            return path == null || path.isEmpty() ? "/" : path;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
