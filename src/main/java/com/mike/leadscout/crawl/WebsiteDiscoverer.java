package com.mike.leadscout.crawl;

import com.mike.leadscout.quality.FieldValidator;
import com.mike.leadscout.resilience.CircuitOpenException;
import com.mike.leadscout.resilience.LeadScoutException;
import com.mike.leadscout.resilience.SourceGuard;
import com.mike.leadscout.util.Domains;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Looks up the website of a business that was listed without one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebsiteDiscoverer {

    static final Set<String> DIRECTORY_DOMAINS = Set.of(
            "yelp.com", "yellowpages.com", "bbb.org", "mapquest.com", "tripadvisor.com", "foursquare.com",
            "google.com", "angi.com", "houzz.com", "thumbtack.com", "nextdoor.com", "manta.com",
            "chamberofcommerce.com", "healthgrades.com", "zocdoc.com", "opentable.com", "wikipedia.org"
    );

    private final WebSearchClient webSearch;
    private final SourceGuard guard;

    /**
     * @return base URL of the first organic result that is neither a directory nor a social profile, or null
     */
    public String discover(String businessName, String address) {
        if (!webSearch.isEnabled() || businessName == null || businessName.isBlank()) return null;

        String query = address == null || address.isBlank() ? businessName : businessName + " " + address;
        List<SearchHit> hits;
        try {
            hits = guard.call(WebSearchClient.SOURCE, () -> webSearch.search(query, 5));
        } catch (CircuitOpenException e) {
            log.info("WebsiteDiscoverer: web search circuit open, skipping '{}'", businessName);
            return null;
        } catch (LeadScoutException e) {
            log.warn("WebsiteDiscoverer: search failed for '{}': {}", businessName, e.getMessage());
            return null;
        }

        for (SearchHit hit : hits) {
            String domain = Domains.extractDomain(hit.link());
            if (domain == null || isDirectory(domain) || FieldValidator.isSocialHost(domain)) continue;
            String website = Domains.toBaseUrl(hit.link());
            log.info("WebsiteDiscoverer: '{}' -> {}", businessName, website);
            return website;
        }
        return null;
    }

    static boolean isDirectory(String domain) {
        return DIRECTORY_DOMAINS.stream().anyMatch(d -> domain.equals(d) || domain.endsWith("." + d));
    }
}
