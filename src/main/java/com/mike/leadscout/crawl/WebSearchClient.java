package com.mike.leadscout.crawl;

import com.mike.leadscout.config.SerpApiProperties;
import com.mike.leadscout.resilience.HttpErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Objects;

/**
 * Organic web search through SerpAPI.
 */
@Component
@Slf4j
public class WebSearchClient {

    public static final String SOURCE = "web-search";

    private final SerpApiProperties props;
    private final RestClient restClient;

    public WebSearchClient(SerpApiProperties props) {
        this.props = props;
        this.restClient = RestClient.builder()
                .baseUrl(props.baseUrl())
                .build();
    }

    public boolean isEnabled() {
        return props.isConfigured();
    }

    public List<SearchHit> search(String query, int limit) {
        int num = Math.max(1, Math.min(limit, 10));
        log.info("WebSearchClient: query='{}', num={}", query, num);

        SerpSearchResponse response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("")
                        .queryParam("engine", props.defaultEngine())
                        .queryParam("hl", props.defaultLanguage())
                        .queryParam("gl", props.defaultCountry())
                        .queryParam("num", num)
                        .queryParam("q", query)
                        .queryParam("api_key", props.apiKey())
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpErrors.raise(SOURCE))
                .body(SerpSearchResponse.class);

        if (response == null || response.organicResults() == null) {
            log.warn("WebSearchClient: empty response or no organic_results for '{}'", query);
            return List.of();
        }

        List<SearchHit> hits = response.organicResults().stream()
                .filter(Objects::nonNull)
                .map(r -> new SearchHit(r.title(), r.link() == null ? null : r.link().trim(), r.snippet()))
                .toList();
        log.debug("WebSearchClient: {} hits for '{}'", hits.size(), query);
        return hits;
    }
}
