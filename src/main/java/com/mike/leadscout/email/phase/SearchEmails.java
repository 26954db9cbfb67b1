package com.mike.leadscout.email.phase;

import com.mike.leadscout.crawl.SearchHit;
import com.mike.leadscout.crawl.WebSearchClient;
import com.mike.leadscout.email.extract.EmailHarvester;
import com.mike.leadscout.email.extract.HarvestedEmail;
import com.mike.leadscout.resilience.CircuitOpenException;
import com.mike.leadscout.resilience.LeadScoutException;
import com.mike.leadscout.resilience.SourceGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Runs guarded web searches and returns the first address in the result snippets that passes a filter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchEmails {

    static final int RESULTS_PER_QUERY = 10;

    private final WebSearchClient webSearch;
    private final SourceGuard guard;
    private final EmailHarvester harvester;

    public boolean isEnabled() {
        return webSearch.isEnabled();
    }

    public String firstMatch(List<String> queries, Predicate<String> accept) {
        for (String query : queries) {
            List<SearchHit> hits;
            try {
                hits = guard.call(WebSearchClient.SOURCE, () -> webSearch.search(query, RESULTS_PER_QUERY));
            } catch (CircuitOpenException e) {
                log.info("SearchEmails: web search circuit open, stopping");
                return null;
            } catch (LeadScoutException e) {
                log.warn("SearchEmails: query '{}' failed: {}", query, e.getMessage());
                continue;
            }

            StringBuilder text = new StringBuilder();
            hits.forEach(h -> text.append(' ').append(h.text()));
            for (HarvestedEmail found : harvester.harvestText(text.toString())) {
                if (accept.test(found.email())) {
                    log.info("SearchEmails: '{}' -> {}", query, found.email());
                    return found.email();
                }
            }
        }
        return null;
    }
}
