package com.mike.leadscout.quality;

import com.mike.leadscout.email.EmailResult;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * One real business merged from every listing that matched it.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalBusiness {
    String id;
    String name;
    String website;
    String phone;
    String address;
    String email;
    @Builder.Default
    Map<String, String> socialProfiles = Map.of();
    Double rating;
    Integer reviewCount;
    @Builder.Default
    Set<String> sources = Set.of();
    QualityProfile quality;
    EmailResult emailResult;

    public int sourceCount() {
        return sources.size();
    }

    public boolean hasVerifiedEmail() {
        return emailResult != null && emailResult.getEmail() != null;
    }

    /**
     * Website found by the cascade when the listing had none.
     */
    public String effectiveWebsite() {
        if (website != null && !website.isBlank()) return website;
        return emailResult == null ? null : emailResult.getDiscoveredWebsite();
    }
}
