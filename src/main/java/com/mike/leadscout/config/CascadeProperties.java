package com.mike.leadscout.config;

import com.mike.leadscout.email.DiscoveryPhase;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "leadscout.cascade")
public class CascadeProperties {

    /**
     * Overrides of the base confidence a phase assigns on success.
     */
    private Map<DiscoveryPhase, Double> baseConfidence = new EnumMap<>(DiscoveryPhase.class);

    /**
     * Accepted results at or above this confidence are written to the cache.
     */
    private double writeThroughThreshold = 0.6;

    private double parkedDomainCap = 0.5;

    private double catchAllPatternCap = 0.65;

    private double apiCatchAllFactor = 0.95;

    /**
     * Ceiling of a confirmed name guess. Stays below the lowest crawl confidence.
     */
    private double permutationCap = 0.82;

    /**
     * A generated role inbox the mail server accepted.
     */
    private double generatedSmtpConfirmed = 0.85;

    /**
     * A generated role inbox when DNS could not say whether the domain takes mail.
     */
    private double generatedUnverified = 0.5;

    /**
     * Subtracted from domain-record confidence for admin and tech contacts.
     */
    private double nonRegistrantPenalty = 0.05;

    private Crawl crawl = new Crawl();

    @Data
    public static class Crawl {
        private int maxContactPaths = 25;

        /**
         * Page budget of the broader site crawl.
         */
        private int pageBudget = 20;

        private int maxSitemapPages = 10;

        private int internalLinksPerPage = 3;

        private Duration pageTimeout = Duration.ofSeconds(15);
    }
}
