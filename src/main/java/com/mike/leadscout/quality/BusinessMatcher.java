package com.mike.leadscout.quality;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Weighted pairwise similarity of two businesses. Phone and domain dominate; a shared phone
 * or domain is near-certain identity on its own.
 */
public final class BusinessMatcher {

    static final double NAME_WEIGHT = 40;
    static final double PHONE_WEIGHT = 25;
    static final double DOMAIN_WEIGHT = 25;
    static final double ADDRESS_WEIGHT = 10;

    static final double PHONE_MATCH_FLOOR = 0.95;
    static final double DOMAIN_MATCH_FLOOR = 0.9;

    private static final double FIELD_MATCH_MIN = 0.8;
    private static final double TOKEN_MATCH_MIN = 0.85;

    private static final Set<String> NAME_STOP_WORDS = Set.of("and", "of", "the", "at", "in", "for", "on");

    private BusinessMatcher() {
    }

    public static SimilarityScore similarity(BusinessSignature a, BusinessSignature b) {
        double total = 0;
        double matched = 0;
        List<String> reasons = new ArrayList<>();

        if (a.name() != null && b.name() != null) {
            total += NAME_WEIGHT;
            double s = compareNames(a.name(), b.name());
            if (s >= FIELD_MATCH_MIN) {
                matched += NAME_WEIGHT * s;
                reasons.add(String.format("name:%.2f", s));
            }
        }

        boolean phoneMatch = false;
        if (a.phone() != null && b.phone() != null) {
            total += PHONE_WEIGHT;
            if (a.phone().equals(b.phone())) {
                matched += PHONE_WEIGHT;
                phoneMatch = true;
                reasons.add("phone");
            }
        }

        boolean domainMatch = false;
        if (a.domain() != null && b.domain() != null) {
            total += DOMAIN_WEIGHT;
            if (a.domain().equals(b.domain())) {
                matched += DOMAIN_WEIGHT;
                domainMatch = true;
                reasons.add("domain");
            }
        }

        if (a.address() != null && b.address() != null) {
            total += ADDRESS_WEIGHT;
            double s = compareAddresses(a.address(), b.address());
            if (s >= FIELD_MATCH_MIN) {
                matched += ADDRESS_WEIGHT * s;
                reasons.add(String.format("address:%.2f", s));
            }
        }

        double score = total == 0 ? 0.0 : matched / total;
        if (phoneMatch) score = Math.max(score, PHONE_MATCH_FLOOR);
        if (domainMatch) score = Math.max(score, DOMAIN_MATCH_FLOOR);
        return new SimilarityScore(Math.min(1.0, score), List.copyOf(reasons));
    }

    /**
     * Best of Jaro-Winkler, fuzzy token overlap and Levenshtein similarity over normalized names.
     */
    public static double compareNames(String a, String b) {
        String na = BusinessNormalizer.normalizeName(a);
        String nb = BusinessNormalizer.normalizeName(b);
        if (na == null || nb == null || na.isEmpty() || nb.isEmpty()) return 0.0;
        if (na.equals(nb)) return 1.0;

        double jw = StringSimilarity.jaroWinkler(na, nb);
        double tokens = tokenScore(na, nb);
        double lev = StringSimilarity.levenshteinSimilarity(na, nb);
        return Math.max(jw, Math.max(tokens, lev));
    }

    static double tokenScore(String a, String b) {
        List<String> ta = tokens(a);
        List<String> tb = tokens(b);
        if (ta.isEmpty() || tb.isEmpty()) return 0.0;

        boolean[] used = new boolean[tb.size()];
        int matches = 0;
        for (String t : ta) {
            int best = -1;
            double bestScore = 0;
            for (int j = 0; j < tb.size(); j++) {
                if (used[j]) continue;
                double s = t.equals(tb.get(j)) ? 1.0 : StringSimilarity.jaroWinkler(t, tb.get(j));
                if (s > bestScore) {
                    bestScore = s;
                    best = j;
                }
            }
            if (best >= 0 && bestScore >= TOKEN_MATCH_MIN) {
                used[best] = true;
                matches++;
            }
        }
        return 2.0 * matches / (ta.size() + tb.size());
    }

    private static List<String> tokens(String s) {
        return Arrays.stream(s.split("[\\s-]+"))
                .filter(t -> t.length() > 1)
                .filter(t -> !NAME_STOP_WORDS.contains(t))
                .collect(Collectors.toList());
    }

    /**
     * Component-wise address match: zip 0.3, state 0.2, city 0.2, street up to 0.3.
     * Falls back to plain string similarity when neither side parses.
     */
    public static double compareAddresses(String a, String b) {
        if (a == null || b == null) return 0.0;
        AddressParts pa = BusinessNormalizer.parseAddress(a);
        AddressParts pb = BusinessNormalizer.parseAddress(b);

        if (pa.isEmpty() || pb.isEmpty()) {
            return StringSimilarity.jaroWinkler(BusinessNormalizer.normalizeAddress(a), BusinessNormalizer.normalizeAddress(b));
        }

        double score = 0.0;
        if (pa.zip() != null && pa.zip().equals(pb.zip())) score += 0.3;
        if (pa.state() != null && pa.state().equals(pb.state())) score += 0.2;
        if (pa.city() != null && pb.city() != null
                && StringSimilarity.jaroWinkler(pa.city().toLowerCase(Locale.ROOT), pb.city().toLowerCase(Locale.ROOT)) >= 0.85) {
            score += 0.2;
        }
        if (pa.street() != null && pb.street() != null) {
            double s = StringSimilarity.jaroWinkler(
                    BusinessNormalizer.normalizeAddress(pa.street()),
                    BusinessNormalizer.normalizeAddress(pb.street()));
            if (s >= 0.8) score += 0.3;
            else if (s >= 0.6) score += 0.15;
        }
        return Math.min(1.0, score);
    }
}
