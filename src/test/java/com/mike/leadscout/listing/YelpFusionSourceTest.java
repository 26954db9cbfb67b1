package com.mike.leadscout.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.leadscout.config.YelpProperties;
import com.mike.leadscout.quality.RawListing;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YelpFusionSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private YelpFusionSource source(String apiKey) {
        return new YelpFusionSource(new YelpProperties(apiKey, "https://api.yelp.com/v3", 50));
    }

    @Test
    @DisplayName("business maps to a listing with the Yelp page as a profile")
    void to_listing() throws Exception {
        //Arrange
        JsonNode business = mapper.readTree("{"
                + "\"name\":\"Smith Family Dental\","
                + "\"url\":\"https://www.yelp.com/biz/smith-family-dental-austin\","
                + "\"phone\":\"+15125550100\",\"display_phone\":\"(512) 555-0100\","
                + "\"rating\":4.5,\"review_count\":87,"
                + "\"location\":{\"display_address\":[\"100 Main St\",\"\",\"Austin, TX 78701\"]}}");

        //Act
        RawListing listing = source("key").toListing(business);

        //Assert
        assertEquals("Smith Family Dental", listing.getName());
        assertEquals("(512) 555-0100", listing.getPhone());
        assertEquals("100 Main St, Austin, TX 78701", listing.getAddress());
        assertEquals(4.5, listing.getRating());
        assertEquals(87, listing.getReviewCount());
        assertEquals(Map.of("yelp", "https://www.yelp.com/biz/smith-family-dental-austin"), listing.getSocialProfiles());
        assertNull(listing.getWebsite());
        assertEquals("yelp", listing.getSourceId());
    }

    @Test
    @DisplayName("sparse business: raw phone, no address, no profile")
    void sparse_business() throws Exception {
        //Arrange
        JsonNode business = mapper.readTree("{\"name\":\"Corner Cafe\",\"phone\":\"+15125550199\",\"display_phone\":\"\"}");
        //Act
        RawListing listing = source("key").toListing(business);
        //Assert
        assertEquals("+15125550199", listing.getPhone());
        assertNull(listing.getAddress());
        assertNull(listing.getRating());
        assertTrue(listing.getSocialProfiles().isEmpty());
    }

    @Test
    @DisplayName("no API key -> disabled; no location -> nothing requested")
    void disabled_and_locationless() {
        assertFalse(source(" ").isEnabled());
        assertTrue(source("key").discoverBusinesses("dentist", "", 10, null).isEmpty());
    }
}
