package com.mike.leadscout.quality;

import com.mike.leadscout.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Groups listings of the same business (transitively: A~B and B~C put A, B, C together)
 * and merges each group into one {@link CanonicalBusiness}.
 */
@Component
@Slf4j
public class DeduplicationEngine {

    private final double threshold;

    public DeduplicationEngine(DiscoveryProperties props) {
        this(props.similarityThreshold());
    }

    public DeduplicationEngine(double threshold) {
        this.threshold = threshold > 0 ? threshold : 0.75;
    }

    public DeduplicationResult deduplicate(List<RawListing> listings) {
        List<RawListing> input = listings == null ? List.of() : listings;
        int n = input.size();

        List<BusinessSignature> sigs = new ArrayList<>(n);
        for (RawListing l : input) {
            sigs.add(BusinessSignature.of(l));
        }

        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                SimilarityScore s = BusinessMatcher.similarity(sigs.get(i), sigs.get(j));
                if (s.score() >= threshold) {
                    log.debug("DeduplicationEngine: '{}' ~ '{}' score={} reasons={}",
                            input.get(i).getName(), input.get(j).getName(), s.score(), s.reasons());
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(i);
        }

        List<CanonicalBusiness> unique = new ArrayList<>();
        List<DuplicateMatch> duplicates = new ArrayList<>();

        for (List<Integer> members : groups.values()) {
            List<Integer> ordered = new ArrayList<>(members);
            ordered.sort(Comparator
                    .comparingInt((Integer i) -> completeness(input.get(i))).reversed()
                    .thenComparing(Comparator.comparingDouble((Integer i) -> baseQuality(input.get(i))).reversed())
                    .thenComparingInt(i -> i));

            CanonicalBusiness merged = merge(ordered.stream().map(input::get).toList());
            unique.add(merged);

            BusinessSignature primary = sigs.get(ordered.get(0));
            for (int k = 1; k < ordered.size(); k++) {
                int idx = ordered.get(k);
                double sim = BusinessMatcher.similarity(primary, sigs.get(idx)).score();
                duplicates.add(new DuplicateMatch(input.get(idx), merged.getId(), sim));
            }
        }

        unique.sort(Comparator
                .comparingDouble((CanonicalBusiness b) -> b.getQuality().getOverallScore()).reversed()
                .thenComparing(Comparator.comparingInt((CanonicalBusiness b) -> businessCompleteness(b)).reversed())
                .thenComparingInt(b -> b.getQuality().getFlags().size()));

        Map<String, Integer> bySource = new TreeMap<>();
        for (RawListing l : input) {
            bySource.merge(l.getSourceId() == null ? "unknown" : l.getSourceId(), 1, Integer::sum);
        }

        DeduplicationStats stats = new DeduplicationStats(n, unique.size(), duplicates.size(), bySource);
        log.info("DeduplicationEngine: {} listings -> {} unique, {} duplicates", n, unique.size(), duplicates.size());
        return new DeduplicationResult(List.copyOf(unique), List.copyOf(duplicates), stats);
    }

    /**
     * Deduplicates, then keeps only records at or above {@code minQuality}, best first, at most {@code maxResults}.
     */
    public DeduplicationResult processBatch(List<RawListing> listings, double minQuality, int maxResults) {
        DeduplicationResult result = deduplicate(listings);
        List<CanonicalBusiness> filtered = result.unique().stream()
                .filter(b -> b.getQuality().getOverallScore() >= minQuality)
                .limit(maxResults > 0 ? maxResults : Long.MAX_VALUE)
                .toList();
        if (filtered.size() < result.unique().size()) {
            log.info("DeduplicationEngine: quality filter kept {} of {} (minQuality={}, maxResults={})",
                    filtered.size(), result.unique().size(), minQuality, maxResults);
        }
        return new DeduplicationResult(filtered, result.duplicates(), result.stats());
    }

    CanonicalBusiness merge(List<RawListing> ordered) {
        RawListing primary = ordered.get(0);
        String name = null;
        String website = null;
        String phone = null;
        String address = null;
        String email = null;
        Double rating = null;
        Integer reviewCount = null;
        Map<String, String> social = new LinkedHashMap<>();
        Set<String> sources = new TreeSet<>();

        for (RawListing l : ordered) {
            if (name == null) name = blankToNull(l.getName());
            if (website == null) website = blankToNull(l.getWebsite());
            if (phone == null) phone = blankToNull(l.getPhone());
            if (address == null) address = blankToNull(l.getAddress());
            if (email == null) email = blankToNull(l.getEmail());
            if (rating == null) rating = l.getRating();
            if (l.getReviewCount() != null && (reviewCount == null || l.getReviewCount() > reviewCount)) {
                reviewCount = l.getReviewCount();
            }
            if (l.getSocialProfiles() != null) {
                l.getSocialProfiles().forEach(social::putIfAbsent);
            }
            if (l.getSourceId() != null) sources.add(l.getSourceId());
        }

        QualityProfile quality = QualityScorer.score(name, phone, address, website, email, sources);
        if (ordered.size() > 1) {
            List<String> flags = new ArrayList<>(quality.getFlags());
            for (RawListing l : ordered.subList(1, ordered.size())) {
                String flag = QualityFlags.MERGED_FROM_PREFIX + l.getSourceId();
                if (l.getSourceId() != null && !flags.contains(flag)) flags.add(flag);
            }
            quality = quality.toBuilder().flags(List.copyOf(flags)).build();
        }

        return CanonicalBusiness.builder()
                .id(canonicalId(name, phone, website, address, primary))
                .name(name)
                .website(website)
                .phone(phone)
                .address(address)
                .email(email)
                .socialProfiles(Map.copyOf(social))
                .rating(rating)
                .reviewCount(reviewCount)
                .sources(Set.copyOf(sources))
                .quality(quality)
                .build();
    }

    static String canonicalId(String name, String phone, String website, String address, RawListing primary) {
        BusinessSignature sig = BusinessSignature.of(name, phone, website, address);
        String key;
        if (sig.phone() != null) {
            key = "phone:" + sig.phone();
        } else if (sig.domain() != null) {
            key = "domain:" + sig.domain();
        } else {
            String zip = BusinessNormalizer.parseAddress(address).zip();
            key = "name:" + sig.name() + "|" + zip + "|" + primary.getSourceId();
        }
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    static int completeness(RawListing l) {
        int c = 0;
        if (l.getName() != null && !l.getName().isBlank()) c++;
        if (l.getWebsite() != null && !l.getWebsite().isBlank()) c++;
        if (l.getPhone() != null && !l.getPhone().isBlank()) c++;
        if (l.getAddress() != null && !l.getAddress().isBlank()) c++;
        if (l.getEmail() != null && !l.getEmail().isBlank()) c++;
        if (l.getSocialProfiles() != null && !l.getSocialProfiles().isEmpty()) c++;
        return c;
    }

    static int businessCompleteness(CanonicalBusiness b) {
        int c = 0;
        if (b.getName() != null) c++;
        if (b.getWebsite() != null) c++;
        if (b.getPhone() != null) c++;
        if (b.getAddress() != null) c++;
        if (b.getEmail() != null) c++;
        if (!b.getSocialProfiles().isEmpty()) c++;
        return c;
    }

    private static double baseQuality(RawListing l) {
        return FieldValidator.validateName(l.getName()).score()
                + FieldValidator.validatePhone(l.getPhone()).score()
                + FieldValidator.validateAddress(l.getAddress()).score()
                + FieldValidator.validateWebsite(l.getWebsite()).score()
                + FieldValidator.validateEmail(l.getEmail()).score();
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) parent[Math.max(ra, rb)] = Math.min(ra, rb);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
