package com.mike.leadscout.quality;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One source's view of a business, as returned by a listing source.
 */
@Value
@Builder(toBuilder = true)
public class RawListing {
    String name;
    String website;
    String phone;
    String address;
    String email;
    @Builder.Default
    Map<String, String> socialProfiles = Map.of();
    Double rating;
    Integer reviewCount;
    String sourceId;
}
