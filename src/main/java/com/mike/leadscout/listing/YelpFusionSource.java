package com.mike.leadscout.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.mike.leadscout.config.YelpProperties;
import com.mike.leadscout.quality.RawListing;
import com.mike.leadscout.resilience.HttpErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Yelp Fusion business search. Yelp returns no business website, only its own listing page.
 */
@Component
@Slf4j
public class YelpFusionSource implements ListingSource {

    static final int MAX_OFFSET = 240;

    private final YelpProperties props;
    private final RestClient restClient;

    public YelpFusionSource(YelpProperties props) {
        this.props = props;
        this.restClient = RestClient.builder()
                .baseUrl(props.baseUrl())
                .build();
    }

    @Override
    public String id() {
        return SourcePrioritizer.YELP;
    }

    @Override
    public boolean isEnabled() {
        return props.isConfigured();
    }

    @Override
    public List<RawListing> discoverBusinesses(String query, String location, int targetCount, ProgressListener onProgress) {
        if (location == null || location.isBlank()) {
            log.info("YelpFusionSource: no location given, skipping '{}'", query);
            return List.of();
        }

        int pageSize = props.pageSize() > 0 ? Math.min(props.pageSize(), 50) : 50;
        List<RawListing> out = new ArrayList<>();

        for (int offset = 0; offset <= MAX_OFFSET && out.size() < targetCount; offset += pageSize) {
            int limit = Math.min(pageSize, targetCount - out.size());
            int from = offset;
            log.info("YelpFusionSource: term='{}', location='{}', offset={}, limit={}", query, location, from, limit);

            JsonNode response = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/businesses/search")
                            .queryParam("term", query)
                            .queryParam("location", location)
                            .queryParam("limit", limit)
                            .queryParam("offset", from)
                            .build())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, HttpErrors.raise(id()))
                    .body(JsonNode.class);

            JsonNode businesses = response == null ? null : response.path("businesses");
            if (businesses == null || !businesses.isArray() || businesses.isEmpty()) break;

            for (JsonNode b : businesses) {
                out.add(toListing(b));
            }
            if (onProgress != null) {
                onProgress.onProgress(out.size() + " listings", Math.min(1.0, (double) out.size() / Math.max(1, targetCount)));
            }
            if (businesses.size() < limit) break;
        }
        return out;
    }

    RawListing toListing(JsonNode b) {
        List<String> lines = new ArrayList<>();
        for (JsonNode line : b.path("location").path("display_address")) {
            if (!line.asText("").isBlank()) lines.add(line.asText());
        }

        String phone = text(b, "display_phone");
        if (phone == null) phone = text(b, "phone");

        String yelpUrl = text(b, "url");
        return RawListing.builder()
                .name(text(b, "name"))
                .phone(phone)
                .address(lines.isEmpty() ? null : String.join(", ", lines))
                .rating(b.hasNonNull("rating") ? b.get("rating").asDouble() : null)
                .reviewCount(b.hasNonNull("review_count") ? b.get("review_count").asInt() : null)
                .socialProfiles(yelpUrl == null ? Map.of() : Map.of("yelp", yelpUrl))
                .sourceId(id())
                .build();
    }

    private static String text(JsonNode node, String field) {
        String v = node.path(field).asText(null);
        return v == null || v.isBlank() ? null : v;
    }
}
