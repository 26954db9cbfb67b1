package com.mike.leadscout.quality;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Field scores, flags and the cross-reference bonus of a merged business.
 */
public final class QualityScorer {

    static final double NAME_WEIGHT = 0.15;
    static final double PHONE_WEIGHT = 0.25;
    static final double ADDRESS_WEIGHT = 0.15;
    static final double WEBSITE_WEIGHT = 0.25;
    static final double EMAIL_WEIGHT = 0.20;

    static final double CROSS_REF_CAP = 0.5;
    private static final double CROSS_REF_DECAY = 0.6;

    enum PremiumSource {
        GOOGLE, YELP, BBB, YELLOW_PAGES;

        static PremiumSource of(String sourceId) {
            if (sourceId == null) return null;
            String s = sourceId.toLowerCase(Locale.ROOT);
            if (s.contains("google") || s.contains("maps")) return GOOGLE;
            if (s.contains("yelp")) return YELP;
            if (s.contains("bbb") || s.contains("better_business")) return BBB;
            if (s.contains("yellow") || s.equals("yp") || s.startsWith("yp_")) return YELLOW_PAGES;
            return null;
        }
    }

    private QualityScorer() {
    }

    public static QualityProfile score(String name, String phone, String address, String website, String email,
                                       Set<String> sources) {
        FieldCheck n = FieldValidator.validateName(name);
        FieldCheck p = FieldValidator.validatePhone(phone);
        FieldCheck a = FieldValidator.validateAddress(address);
        FieldCheck w = FieldValidator.validateWebsite(website);
        FieldCheck e = FieldValidator.validateEmail(email);

        List<String> flags = new ArrayList<>();
        flags.addAll(n.flags());
        flags.addAll(p.flags());
        flags.addAll(a.flags());
        flags.addAll(w.flags());
        flags.addAll(e.flags());

        int sourceCount = sources == null ? 0 : sources.size();
        double crossRef = crossRefScore(sources);
        double overall = Math.min(1.0,
                NAME_WEIGHT * n.score()
                        + PHONE_WEIGHT * p.score()
                        + ADDRESS_WEIGHT * a.score()
                        + WEBSITE_WEIGHT * w.score()
                        + EMAIL_WEIGHT * e.score()
                        + crossRef);

        return QualityProfile.builder()
                .nameScore(n.score())
                .phoneScore(p.score())
                .addressScore(a.score())
                .websiteScore(w.score())
                .emailScore(e.score())
                .flags(List.copyOf(flags))
                .sourceCount(sourceCount)
                .crossRefScore(crossRef)
                .overallScore(overall)
                .build();
    }

    /**
     * Zero for one source or none. Otherwise grows with each extra source with diminishing returns,
     * bumped when two or more high-trust directories agree, and never above 0.5.
     */
    public static double crossRefScore(Set<String> sources) {
        if (sources == null || sources.size() <= 1) return 0.0;

        EnumSet<PremiumSource> premium = EnumSet.noneOf(PremiumSource.class);
        for (String s : sources) {
            PremiumSource ps = PremiumSource.of(s);
            if (ps != null) premium.add(ps);
        }

        double bump = premium.size() >= 3 ? 0.5 : premium.size() == 2 ? 0.25 : 0.0;
        double x = sources.size() + bump;
        return Math.min(CROSS_REF_CAP, CROSS_REF_CAP * (1.0 - Math.pow(CROSS_REF_DECAY, x - 1)));
    }
}
