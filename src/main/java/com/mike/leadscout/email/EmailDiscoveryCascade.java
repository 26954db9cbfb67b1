package com.mike.leadscout.email;

import com.mike.leadscout.browser.BrowserSessionFactory;
import com.mike.leadscout.cache.EmailCache;
import com.mike.leadscout.crawl.WebsiteDiscoverer;
import com.mike.leadscout.email.verify.CatchAllDetector;
import com.mike.leadscout.email.verify.DomainMxVerifier;
import com.mike.leadscout.metrics.LeadScoutMetrics;
import com.mike.leadscout.quality.CanonicalBusiness;
import com.mike.leadscout.resilience.CancellationToken;
import com.mike.leadscout.resilience.JobCancelledException;
import com.mike.leadscout.util.Domains;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Runs the discovery phases for one business in order and returns the first candidate that clears
 * its phase's acceptance floor after catch-all adjustment. Published addresses must also pass the
 * MX gate. Accepted results at or above the write-through threshold are cached by domain.
 */
@Service
@Slf4j
public class EmailDiscoveryCascade {

    private final List<PhaseStep> steps;
    private final ConfidenceTable confidenceTable;
    private final EmailCache emailCache;
    private final CatchAllDetector catchAllDetector;
    private final DomainMxVerifier mxVerifier;
    private final WebsiteDiscoverer websiteDiscoverer;
    private final BrowserSessionFactory sessionFactory;
    private final LeadScoutMetrics metrics;

    public EmailDiscoveryCascade(List<CascadePhase> phases,
                                 ConfidenceTable confidenceTable,
                                 EmailCache emailCache,
                                 CatchAllDetector catchAllDetector,
                                 DomainMxVerifier mxVerifier,
                                 WebsiteDiscoverer websiteDiscoverer,
                                 BrowserSessionFactory sessionFactory,
                                 LeadScoutMetrics metrics) {
        this.confidenceTable = confidenceTable;
        this.emailCache = emailCache;
        this.catchAllDetector = catchAllDetector;
        this.mxVerifier = mxVerifier;
        this.websiteDiscoverer = websiteDiscoverer;
        this.sessionFactory = sessionFactory;
        this.metrics = metrics;
        this.steps = phases.stream()
                .sorted(Comparator.comparingInt(p -> p.phase().ordinal()))
                .map(p -> new PhaseStep(p.phase(), p, confidenceTable.minAccept(p.phase())))
                .toList();
        log.info("EmailDiscoveryCascade: phases {}", steps.stream().map(s -> s.phase().label()).toList());
    }

    public List<PhaseStep> steps() {
        return steps;
    }

    public EmailResult resolve(CanonicalBusiness business) {
        return resolve(business, CancellationToken.none());
    }

    /**
     * @throws JobCancelledException when the token is cancelled between phases
     */
    public EmailResult resolve(CanonicalBusiness business, CancellationToken token) {
        String website = business.getWebsite();
        boolean discovered = false;
        if (website == null || website.isBlank()) {
            website = websiteDiscoverer.discover(business.getName(), business.getAddress());
            discovered = website != null;
        }
        String discoveredWebsite = discovered ? website : null;

        try (EmailLookup lookup = new EmailLookup(business, website, discovered, sessionFactory, token)) {
            for (PhaseStep step : steps) {
                lookup.getToken().throwIfCancelled();
                if (!step.attempt().appliesTo(lookup)) continue;

                EmailCandidate candidate = attempt(step, lookup);
                if (candidate == null || candidate.email() == null) continue;
                if (candidate.evidence() == Evidence.DISCOVERED && !mxVerifier.accepts(candidate.email())) {
                    log.info("EmailDiscoveryCascade: {} dropped {} for {}, mail domain takes no mail",
                            step.phase().label(), candidate.email(), lookup.getDomain());
                    continue;
                }

                boolean catchAll = catchAllFor(candidate, lookup);
                double adjusted = confidenceTable.adjustForCatchAll(candidate.confidence(), catchAll, candidate.evidence());
                if (adjusted < step.minAccept()) {
                    log.debug("EmailDiscoveryCascade: {} rejected {} for {} (confidence {} < {})",
                            step.phase().label(), candidate.email(), lookup.getDomain(), adjusted, step.minAccept());
                    continue;
                }
                return accept(candidate, adjusted, catchAll, lookup, discoveredWebsite);
            }
        }

        log.info("EmailDiscoveryCascade: no email for '{}' ({})", business.getName(), website);
        return EmailResult.none(discoveredWebsite);
    }

    private EmailCandidate attempt(PhaseStep step, EmailLookup lookup) {
        try {
            return step.attempt().attempt(lookup);
        } catch (JobCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("EmailDiscoveryCascade: phase {} failed for {}: {}", step.phase().label(), lookup.getDomain(), e.getMessage());
            return null;
        }
    }

    private EmailResult accept(EmailCandidate candidate, double adjusted, boolean catchAll,
                               EmailLookup lookup, String discoveredWebsite) {
        double finalConfidence = confidenceTable.capForParkedDomain(adjusted, lookup.isParkedDomain());
        metrics.phaseHit(candidate.phase());

        if (candidate.phase() != DiscoveryPhase.CACHE
                && lookup.getDomain() != null
                && finalConfidence >= confidenceTable.writeThroughThreshold()) {
            emailCache.store(lookup.getDomain(), candidate.email(), finalConfidence, candidate.source(), catchAll);
        }

        log.info("EmailDiscoveryCascade: {} -> {} via {} (confidence={}{})",
                lookup.getDomain(), candidate.email(), candidate.source(), finalConfidence,
                catchAll ? ", catch-all" : "");

        return EmailResult.builder()
                .email(candidate.email())
                .source(candidate.source())
                .confidence(finalConfidence)
                .phase(candidate.phase())
                .catchAll(catchAll)
                .discoveredWebsite(discoveredWebsite)
                .build();
    }

    /**
     * Catch-all status of the candidate's mail domain. Source hints win; otherwise the detector
     * is asked once per mail domain per run.
     */
    private boolean catchAllFor(EmailCandidate candidate, EmailLookup lookup) {
        if (candidate.catchAllHint() != null) return candidate.catchAllHint();
        String mailDomain = Domains.emailDomain(candidate.email());
        Boolean known = lookup.catchAll(mailDomain);
        if (candidate.evidence() == Evidence.CACHED || candidate.evidence() == Evidence.DISCOVERED) {
            return known != null && known;
        }
        if (known != null) return known;
        if (mailDomain == null) return false;

        boolean catchAll;
        try {
            catchAll = catchAllDetector.isCatchAll(mailDomain);
        } catch (RuntimeException e) {
            log.warn("EmailDiscoveryCascade: catch-all probe failed for {}: {}", mailDomain, e.getMessage());
            catchAll = false;
        }
        lookup.rememberCatchAll(mailDomain, catchAll);
        return catchAll;
    }
}
