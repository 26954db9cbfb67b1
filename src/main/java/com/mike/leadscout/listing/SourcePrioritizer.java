package com.mike.leadscout.listing;

import com.mike.leadscout.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Orders listing sources for a query: category plan first, historical yield within a priority group.
 */
@Component
@Slf4j
public class SourcePrioritizer {

    public static final String GOOGLE_MAPS = "google_maps";
    public static final String YELP = "yelp";
    public static final String YELLOW_PAGES = "yellow_pages";
    public static final String BBB = "bbb";
    public static final String MANTA = "manta";

    private static final Map<QueryCategory, List<SourceDescriptor>> PLANS = new EnumMap<>(QueryCategory.class);

    static {
        List<SourceDescriptor> local = List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 15),
                SourceDescriptor.later(BBB, 2, true, 15));

        PLANS.put(QueryCategory.MEDICAL, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.later(YELP, 2, true, 10),
                SourceDescriptor.later(MANTA, 2, true, 15),
                SourceDescriptor.later(BBB, 3, false, 20)));
        PLANS.put(QueryCategory.HOME_SERVICES, local);
        PLANS.put(QueryCategory.RESTAURANT_FOOD, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 20)));
        PLANS.put(QueryCategory.RETAIL, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 15)));
        PLANS.put(QueryCategory.PROFESSIONAL_SERVICES, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.first(BBB),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 15)));
        PLANS.put(QueryCategory.BEAUTY_WELLNESS, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 20)));
        PLANS.put(QueryCategory.AUTOMOTIVE, local);
        PLANS.put(QueryCategory.ONLINE_BRAND, List.of(
                SourceDescriptor.first(GOOGLE_MAPS)));
        PLANS.put(QueryCategory.ENTERTAINMENT, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 20)));
        PLANS.put(QueryCategory.EDUCATION, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 15),
                SourceDescriptor.later(BBB, 2, true, 20)));
        PLANS.put(QueryCategory.PET_SERVICES, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.first(YELP),
                SourceDescriptor.later(YELLOW_PAGES, 2, true, 15),
                SourceDescriptor.later(MANTA, 2, true, 20),
                SourceDescriptor.later(BBB, 3, false, 25)));
        PLANS.put(QueryCategory.GENERAL_LOCAL, local);
        PLANS.put(QueryCategory.GENERAL_ONLINE, List.of(
                SourceDescriptor.first(GOOGLE_MAPS),
                SourceDescriptor.later(YELP, 2, false, 15)));
    }

    private final KeyValueStore<String, SourceYield> yieldStore;

    public SourcePrioritizer(@Qualifier("yieldStore") KeyValueStore<String, SourceYield> yieldStore) {
        this.yieldStore = yieldStore;
    }

    public static List<SourceDescriptor> planFor(QueryCategory category) {
        return PLANS.getOrDefault(category, PLANS.get(QueryCategory.GENERAL_LOCAL));
    }

    /**
     * Priority groups for the query, restricted to {@code available} source ids. Available sources
     * missing from the category plan run last, each with no result threshold.
     */
    public List<List<SourceDescriptor>> plan(String query, String location, Collection<String> available) {
        boolean hasLocation = location != null && !location.isBlank();
        QueryCategory category = QueryCategory.detect(query, hasLocation);

        Set<String> remaining = new LinkedHashSet<>(available);
        List<SourceDescriptor> planned = new ArrayList<>();
        int lastPriority = 1;
        for (SourceDescriptor d : planFor(category)) {
            if (!remaining.remove(d.sourceId())) continue;
            planned.add(d);
            lastPriority = Math.max(lastPriority, d.priority());
        }
        for (String id : remaining) {
            planned.add(new SourceDescriptor(id, lastPriority + 1, true, 0));
        }

        List<List<SourceDescriptor>> groups = groupByPriority(planned);
        log.info("SourcePrioritizer: query='{}' category={} groups={}", query, category, groups.size());
        return groups;
    }

    /**
     * Groups in ascending priority; within a group the better historical yield goes first.
     */
    public List<List<SourceDescriptor>> groupByPriority(List<SourceDescriptor> sources) {
        Map<Integer, List<SourceDescriptor>> byPriority = new TreeMap<>();
        for (SourceDescriptor d : sources) {
            byPriority.computeIfAbsent(d.priority(), p -> new ArrayList<>()).add(d);
        }

        List<List<SourceDescriptor>> groups = new ArrayList<>();
        for (List<SourceDescriptor> group : byPriority.values()) {
            group.sort(Comparator.comparingDouble((SourceDescriptor d) -> yieldOf(d.sourceId()).listingsPerCall()).reversed());
            groups.add(List.copyOf(group));
        }
        return groups;
    }

    public static List<SourceDescriptor> filterByResultCount(List<SourceDescriptor> group, int collected) {
        return group.stream()
                .filter(d -> d.isWanted(collected))
                .toList();
    }

    public void recordYield(String sourceId, int listings) {
        yieldStore.put(sourceId, yieldOf(sourceId).plus(listings));
    }

    public SourceYield yieldOf(String sourceId) {
        SourceYield y = yieldStore.get(sourceId);
        return y == null ? SourceYield.none() : y;
    }
}
