package com.mike.leadscout.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SerpSearchResponse(
        @JsonProperty("organic_results")
        List<OrganicResult> organicResults
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrganicResult(
            String title,
            String link,
            String snippet
    ) {
    }
}
