package com.mike.leadscout.listing;

import com.mike.leadscout.store.CaffeineKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourcePrioritizerTest {

    private SourcePrioritizer prioritizer;

    @BeforeEach
    void setUp() {
        prioritizer = new SourcePrioritizer(CaffeineKeyValueStore.inMemory());
    }

    private static List<List<String>> ids(List<List<SourceDescriptor>> groups) {
        return groups.stream().map(g -> g.stream().map(SourceDescriptor::sourceId).toList()).toList();
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("medical query -> maps first, yelp in the second group")
        void medical_plan() {
            //Act
            List<List<SourceDescriptor>> groups = prioritizer.plan("dentist", "Austin, TX",
                    List.of(SourcePrioritizer.YELP, SourcePrioritizer.GOOGLE_MAPS));
            //Assert
            assertEquals(List.of(List.of("google_maps"), List.of("yelp")), ids(groups));
            assertEquals(10, groups.get(1).get(0).minResults());
        }

        @Test
        @DisplayName("unavailable sources are left out; unplanned ones run last without threshold")
        void unplanned_last() {
            //Act
            List<List<SourceDescriptor>> groups = prioritizer.plan("plumber", "Austin, TX",
                    List.of(SourcePrioritizer.GOOGLE_MAPS, "city_registry"));
            //Assert
            assertEquals(List.of(List.of("google_maps"), List.of("city_registry")), ids(groups));
            SourceDescriptor unplanned = groups.get(1).get(0);
            assertEquals(2, unplanned.priority());
            assertEquals(0, unplanned.minResults());
            assertTrue(unplanned.parallel());
        }

        @Test
        @DisplayName("no available source -> empty plan")
        void nothing_available() {
            assertTrue(prioritizer.plan("plumber", "Austin, TX", List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("yield")
    class Yield {

        @Test
        @DisplayName("better listings-per-call goes first within a group")
        void yield_orders_group() {
            //Arrange
            prioritizer.recordYield(SourcePrioritizer.GOOGLE_MAPS, 10);
            prioritizer.recordYield(SourcePrioritizer.YELP, 40);
            //Act
            List<List<SourceDescriptor>> groups = prioritizer.plan("plumber", "Austin, TX",
                    List.of(SourcePrioritizer.GOOGLE_MAPS, SourcePrioritizer.YELP));
            //Assert
            assertEquals(List.of(List.of("yelp", "google_maps")), ids(groups));
        }

        @Test
        @DisplayName("yield accumulates calls and listings")
        void yield_accumulates() {
            //Arrange
            prioritizer.recordYield(SourcePrioritizer.YELP, 30);
            prioritizer.recordYield(SourcePrioritizer.YELP, 0);
            //Act
            SourceYield y = prioritizer.yieldOf(SourcePrioritizer.YELP);
            //Assert
            assertEquals(2, y.calls());
            assertEquals(15.0, y.listingsPerCall());
        }
    }

    @Test
    @DisplayName("threshold filter drops sources once enough listings are collected")
    void filter_by_result_count() {
        //Arrange
        List<SourceDescriptor> group = List.of(
                new SourceDescriptor("yellow_pages", 2, true, 15),
                new SourceDescriptor("city_registry", 2, true, 0));
        //Act
        List<SourceDescriptor> wanted = SourcePrioritizer.filterByResultCount(group, 15);
        //Assert
        assertEquals(List.of("city_registry"), wanted.stream().map(SourceDescriptor::sourceId).toList());
    }
}
