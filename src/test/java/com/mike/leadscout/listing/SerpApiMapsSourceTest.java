package com.mike.leadscout.listing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.leadscout.config.SerpApiProperties;
import com.mike.leadscout.quality.RawListing;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SerpApiMapsSourceTest {

    private final SerpApiMapsSource source = new SerpApiMapsSource(
            new SerpApiProperties("key", "https://serpapi.com/search.json", "us", "en", "google_maps"));

    @Test
    @DisplayName("local result maps to a listing")
    void to_listing() throws Exception {
        //Arrange
        MapsSearchResponse response = new ObjectMapper().readValue("{\"search_metadata\":{\"id\":\"x\"},"
                + "\"local_results\":[{\"position\":1,\"title\":\"Smith Family Dental\",\"phone\":\"(512) 555-0100\","
                + "\"address\":\"100 Main St, Austin, TX\",\"website\":\"https://smithdental.com/\","
                + "\"rating\":4.8,\"reviews\":132,\"type\":\"Dentist\"}]}", MapsSearchResponse.class);

        //Act
        RawListing listing = source.toListing(response.localResults().get(0));

        //Assert
        assertEquals("Smith Family Dental", listing.getName());
        assertEquals("(512) 555-0100", listing.getPhone());
        assertEquals("100 Main St, Austin, TX", listing.getAddress());
        assertEquals("https://smithdental.com/", listing.getWebsite());
        assertEquals(4.8, listing.getRating());
        assertEquals(132, listing.getReviewCount());
        assertEquals("google_maps", listing.getSourceId());
        assertTrue(listing.getSocialProfiles().isEmpty());
    }

    @Test
    @DisplayName("missing fields stay null")
    void missing_fields() throws Exception {
        //Arrange
        MapsSearchResponse response = new ObjectMapper().readValue(
                "{\"local_results\":[{\"title\":\"Corner Cafe\"}]}", MapsSearchResponse.class);
        //Act
        RawListing listing = source.toListing(response.localResults().get(0));
        //Assert
        assertNull(listing.getWebsite());
        assertNull(listing.getReviewCount());
    }

    @Test
    @DisplayName("enabled only with an API key")
    void enabled() {
        assertTrue(source.isEnabled());
        assertFalse(new SerpApiMapsSource(new SerpApiProperties(null, "https://serpapi.com/search.json", "us", "en", "google_maps")).isEnabled());
    }
}
