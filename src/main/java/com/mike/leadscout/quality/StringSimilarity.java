package com.mike.leadscout.quality;

public final class StringSimilarity {

    private static final double PREFIX_SCALE = 0.1;
    private static final int MAX_PREFIX = 4;

    private StringSimilarity() {
    }

    public static double jaro(String a, String b) {
        if (a == null || b == null) return 0.0;
        if (a.equals(b)) return a.isEmpty() ? 0.0 : 1.0;
        if (a.isEmpty() || b.isEmpty()) return 0.0;

        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] aMatched = new boolean[a.length()];
        boolean[] bMatched = new boolean[b.length()];

        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length() - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (bMatched[j] || a.charAt(i) != b.charAt(j)) continue;
                aMatched[i] = true;
                bMatched[j] = true;
                matches++;
                break;
            }
        }
        if (matches == 0) return 0.0;

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < a.length(); i++) {
            if (!aMatched[i]) continue;
            while (!bMatched[k]) k++;
            if (a.charAt(i) != b.charAt(k)) transpositions++;
            k++;
        }

        double m = matches;
        return (m / a.length() + m / b.length() + (m - transpositions / 2.0) / m) / 3.0;
    }

    public static double jaroWinkler(String a, String b) {
        double jaro = jaro(a, b);
        if (jaro == 0.0) return 0.0;
        int prefix = 0;
        int limit = Math.min(MAX_PREFIX, Math.min(a.length(), b.length()));
        while (prefix < limit && a.charAt(prefix) == b.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * PREFIX_SCALE * (1.0 - jaro);
    }

    public static int levenshtein(String a, String b) {
        if (a == null) a = "";
        if (b == null) b = "";
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /**
     * 1 - distance / longer length.
     */
    public static double levenshteinSimilarity(String a, String b) {
        if (a == null || b == null) return 0.0;
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) return 0.0;
        return 1.0 - (double) levenshtein(a, b) / longer;
    }
}
