package com.mike.leadscout.listing;

import com.mike.leadscout.config.SerpApiProperties;
import com.mike.leadscout.quality.RawListing;
import com.mike.leadscout.resilience.HttpErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Google Maps local results through SerpAPI, paged 20 at a time.
 */
@Component
@Slf4j
public class SerpApiMapsSource implements ListingSource {

    static final String ENGINE = "google_maps";
    static final int PAGE_SIZE = 20;
    static final int MAX_PAGES = 5;

    private final SerpApiProperties props;
    private final RestClient restClient;

    public SerpApiMapsSource(SerpApiProperties props) {
        this.props = props;
        this.restClient = RestClient.builder()
                .baseUrl(props.baseUrl())
                .build();
    }

    @Override
    public String id() {
        return SourcePrioritizer.GOOGLE_MAPS;
    }

    @Override
    public boolean isEnabled() {
        return props.isConfigured();
    }

    @Override
    public List<RawListing> discoverBusinesses(String query, String location, int targetCount, ProgressListener onProgress) {
        String q = location == null || location.isBlank() ? query : query + " in " + location;
        List<RawListing> out = new ArrayList<>();

        for (int page = 0; page < MAX_PAGES && out.size() < targetCount; page++) {
            int start = page * PAGE_SIZE;
            log.info("SerpApiMapsSource: query='{}', start={}", q, start);

            MapsSearchResponse response = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("")
                            .queryParam("engine", ENGINE)
                            .queryParam("type", "search")
                            .queryParam("hl", props.defaultLanguage())
                            .queryParam("q", q)
                            .queryParam("start", start)
                            .queryParam("api_key", props.apiKey())
                            .build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, HttpErrors.raise(id()))
                    .body(MapsSearchResponse.class);

            if (response == null || response.localResults() == null || response.localResults().isEmpty()) {
                log.info("SerpApiMapsSource: no more local_results after {} listings", out.size());
                break;
            }

            response.localResults().stream()
                    .filter(Objects::nonNull)
                    .map(this::toListing)
                    .forEach(out::add);
            if (onProgress != null) {
                onProgress.onProgress("page " + (page + 1) + ": " + out.size() + " listings",
                        Math.min(1.0, (double) out.size() / Math.max(1, targetCount)));
            }
            if (response.localResults().size() < PAGE_SIZE) break;
        }

        return out.size() > targetCount ? List.copyOf(out.subList(0, targetCount)) : out;
    }

    RawListing toListing(MapsSearchResponse.LocalResult r) {
        return RawListing.builder()
                .name(r.title())
                .phone(r.phone())
                .address(r.address())
                .website(r.website())
                .rating(r.rating())
                .reviewCount(r.reviews())
                .sourceId(id())
                .build();
    }
}
