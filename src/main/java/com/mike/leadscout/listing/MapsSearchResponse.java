package com.mike.leadscout.listing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MapsSearchResponse(
        @JsonProperty("local_results")
        List<LocalResult> localResults
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocalResult(
            String title,
            String phone,
            String address,
            String website,
            Double rating,
            Integer reviews
    ) {
    }
}
