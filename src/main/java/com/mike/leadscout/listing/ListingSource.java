package com.mike.leadscout.listing;

import com.mike.leadscout.quality.RawListing;

import java.util.List;

/**
 * An external directory that returns business listings for a query and location.
 */
public interface ListingSource {

    /**
     * Stable id, also used as the listing's source id and the circuit-breaker key.
     */
    String id();

    boolean isEnabled();

    /**
     * @throws com.mike.leadscout.resilience.LeadScoutException on transport or API failure
     */
    List<RawListing> discoverBusinesses(String query, String location, int targetCount, ProgressListener onProgress);
}
