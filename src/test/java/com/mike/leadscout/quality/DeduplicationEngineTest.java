package com.mike.leadscout.quality;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeduplicationEngineTest {

    private DeduplicationEngine engine;
    private List<RawListing> listings;

    @BeforeEach
    void setUp() {
        engine = new DeduplicationEngine(0.75);
        listings = List.of(
                RawListing.builder()
                        .name("Smith Dental")
                        .phone("512-430-1100")
                        .address("100 Congress Ave, Austin, TX 78701")
                        .website("https://www.smithdental.com")
                        .sourceId("google_maps")
                        .build(),
                RawListing.builder()
                        .name("Smith Dental LLC")
                        .phone("+1 (512) 430-1100")
                        .address("100 Congress Avenue, Austin, TX 78701")
                        .rating(4.7)
                        .sourceId("yelp")
                        .build(),
                RawListing.builder()
                        .name("Jones Orthodontics")
                        .phone("512-430-2200")
                        .address("200 Lamar Blvd, Austin, TX 78704")
                        .sourceId("bbb")
                        .build());
    }

    @Test
    @DisplayName("Smith Dental twice + Jones Orthodontics -> 2 businesses")
    void deduplicate_merges_matching_phone() {
        //Act
        DeduplicationResult result = engine.deduplicate(listings);
        //Assert
        assertEquals(2, result.unique().size());
        assertEquals(1, result.duplicates().size());

        CanonicalBusiness smith = result.unique().stream()
                .filter(b -> b.getName().startsWith("Smith"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, smith.sourceCount());
        assertTrue(smith.getQuality().getCrossRefScore() > 0);
        assertEquals("https://www.smithdental.com", smith.getWebsite());
        assertEquals(4.7, smith.getRating());
        assertTrue(smith.getQuality().hasFlag(QualityFlags.MERGED_FROM_PREFIX + "yelp"));
    }

    @Test
    @DisplayName("stats count listings, unique records and sources")
    void deduplicate_stats() {
        //Act
        DeduplicationStats stats = engine.deduplicate(listings).stats();
        //Assert
        assertEquals(3, stats.total());
        assertEquals(2, stats.unique());
        assertEquals(1, stats.duplicates());
        assertEquals(1, stats.bySource().get("bbb"));
    }

    @Test
    @DisplayName("merged record ranks first")
    void deduplicate_sorted_by_overall_score() {
        //Act
        DeduplicationResult result = engine.deduplicate(listings);
        //Assert
        assertTrue(result.unique().get(0).getName().startsWith("Smith"));
    }

    @Test
    @DisplayName("same input -> same canonical ids")
    void deduplicate_ids_are_stable() {
        //Act
        String first = engine.deduplicate(listings).unique().get(0).getId();
        String second = engine.deduplicate(listings).unique().get(0).getId();
        //Assert
        assertNotNull(first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("processBatch: maxResults limits output")
    void processBatch_limits() {
        //Act
        DeduplicationResult result = engine.processBatch(listings, 0.0, 1);
        //Assert
        assertEquals(1, result.unique().size());
    }

    @Test
    @DisplayName("processBatch: quality threshold filters weak records")
    void processBatch_filters_by_quality() {
        //Act
        DeduplicationResult result = engine.processBatch(listings, 0.6, 0);
        //Assert
        assertEquals(1, result.unique().size());
        assertTrue(result.unique().get(0).getName().startsWith("Smith"));
    }

    @Test
    @DisplayName("null input -> empty result")
    void deduplicate_null() {
        //Act
        DeduplicationResult result = engine.deduplicate(null);
        //Assert
        assertTrue(result.unique().isEmpty());
        assertEquals(0, result.stats().total());
    }
}
