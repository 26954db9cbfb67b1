package com.mike.leadscout.email;

import com.mike.leadscout.config.CascadeProperties;
import com.mike.leadscout.email.extract.EmailPriority;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Every confidence constant of the cascade. Phases ask this table for their tiers instead of
 * carrying numbers of their own.
 */
@Component
public class ConfidenceTable {

    static final double MIN_CONFIDENCE = 0.0;
    static final double MAX_CONFIDENCE = 0.95;

    static final double CRAWL_FLOOR = 0.82;
    static final double GENERIC_BONUS = 0.03;
    static final double OTHER_PENALTY = 0.03;
    static final double OFF_DOMAIN_PENALTY = 0.05;

    private static final Map<DiscoveryPhase, Double> DEFAULT_BASE = new EnumMap<>(DiscoveryPhase.class);
    private static final Map<DiscoveryPhase, Double> MIN_ACCEPT = new EnumMap<>(DiscoveryPhase.class);

    static {
        base(DiscoveryPhase.CACHE, 0.70, 0.70);
        base(DiscoveryPhase.CONTACT_API, 0.85, 0.80);
        base(DiscoveryPhase.WEBSITE_CRAWL, 0.90, 0.80);
        base(DiscoveryPhase.SITE_CRAWL, 0.90, 0.80);
        base(DiscoveryPhase.SITEMAP, 0.90, 0.80);
        base(DiscoveryPhase.SOCIAL, 0.85, 0.80);
        base(DiscoveryPhase.WEB_SEARCH, 0.82, 0.80);
        base(DiscoveryPhase.LICENSING_BOARD, 0.82, 0.80);
        base(DiscoveryPhase.NAME_PERMUTATION, 0.80, 0.60);
        base(DiscoveryPhase.DOMAIN_RECORD, 0.75, 0.70);
        base(DiscoveryPhase.GENERATED, 0.60, 0.50);
    }

    private final Map<DiscoveryPhase, Double> baseConfidence;
    private final double parkedDomainCap;
    private final double catchAllPatternCap;
    private final double apiCatchAllFactor;
    private final double writeThroughThreshold;
    private final double permutationCap;
    private final double generatedSmtpConfirmed;
    private final double generatedUnverified;
    private final double nonRegistrantPenalty;

    public ConfidenceTable(CascadeProperties props) {
        Map<DiscoveryPhase, Double> merged = new EnumMap<>(DEFAULT_BASE);
        if (props.getBaseConfidence() != null) {
            merged.putAll(props.getBaseConfidence());
        }
        this.baseConfidence = Collections.unmodifiableMap(merged);
        this.parkedDomainCap = props.getParkedDomainCap();
        this.catchAllPatternCap = props.getCatchAllPatternCap();
        this.apiCatchAllFactor = props.getApiCatchAllFactor();
        this.writeThroughThreshold = props.getWriteThroughThreshold();
        this.permutationCap = Math.min(props.getPermutationCap(), CRAWL_FLOOR);
        this.generatedSmtpConfirmed = props.getGeneratedSmtpConfirmed();
        this.generatedUnverified = props.getGeneratedUnverified();
        this.nonRegistrantPenalty = props.getNonRegistrantPenalty();
    }

    public static ConfidenceTable defaults() {
        return new ConfidenceTable(new CascadeProperties());
    }

    public double base(DiscoveryPhase phase) {
        return baseConfidence.get(phase);
    }

    public double minAccept(DiscoveryPhase phase) {
        return MIN_ACCEPT.get(phase);
    }

    public double writeThroughThreshold() {
        return writeThroughThreshold;
    }

    /**
     * Confidence of an address found on the business's own pages: generic inboxes rank above
     * departmental ones, and addresses off the site's domain rank lower.
     */
    public double crawlConfidence(DiscoveryPhase phase, int priority, boolean onDomain) {
        double c = base(phase);
        if (priority == EmailPriority.GENERIC) c += GENERIC_BONUS;
        if (priority == EmailPriority.OTHER) c -= OTHER_PENALTY;
        if (!onDomain) c -= OFF_DOMAIN_PENALTY;
        return clamp(Math.max(CRAWL_FLOOR, c));
    }

    /**
     * A confirmed name guess, whether an API or the mail server confirmed it. The learned-pattern
     * boost never lifts it past the lowest crawl tier.
     */
    public double permutationConfidence(double boost) {
        return clamp(Math.min(base(DiscoveryPhase.NAME_PERMUTATION) + boost, permutationCap));
    }

    public double generatedConfirmed() {
        return clamp(generatedSmtpConfirmed);
    }

    public double generatedUnverified() {
        return clamp(generatedUnverified);
    }

    /**
     * The registrant contact gets the phase base; admin and tech contacts rank a step lower.
     */
    public double domainRecordConfidence(String role) {
        double c = base(DiscoveryPhase.DOMAIN_RECORD);
        if (!"registrant".equals(role)) c -= nonRegistrantPenalty;
        return clamp(c);
    }

    /**
     * On a catch-all domain a server "accept" proves nothing about the mailbox: pattern-based
     * results are capped, API verdicts are scaled down, published addresses are left alone.
     */
    public double adjustForCatchAll(double confidence, boolean catchAll, boolean patternBased) {
        if (!catchAll) return clamp(confidence);
        if (patternBased) return clamp(Math.min(confidence, catchAllPatternCap));
        return clamp(confidence * apiCatchAllFactor);
    }

    public double adjustForCatchAll(double confidence, boolean catchAll, Evidence evidence) {
        if (evidence == Evidence.CACHED || evidence == Evidence.DISCOVERED) return clamp(confidence);
        return adjustForCatchAll(confidence, catchAll, evidence.isPatternBased());
    }

    public double capForParkedDomain(double confidence, boolean parked) {
        return parked ? Math.min(confidence, parkedDomainCap) : confidence;
    }

    /**
     * Final confidence of an accepted candidate.
     */
    public double adjust(EmailCandidate candidate, boolean catchAll, boolean parked) {
        double c = adjustForCatchAll(candidate.confidence(), catchAll, candidate.evidence());
        return capForParkedDomain(c, parked);
    }

    static double clamp(double c) {
        if (Double.isNaN(c)) return MIN_CONFIDENCE;
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, c));
    }

    private static void base(DiscoveryPhase phase, double base, double minAccept) {
        DEFAULT_BASE.put(phase, base);
        MIN_ACCEPT.put(phase, minAccept);
    }
}
