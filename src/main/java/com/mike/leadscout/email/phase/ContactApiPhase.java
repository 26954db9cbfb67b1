package com.mike.leadscout.email.phase;

import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.extract.EmailFilter;
import com.mike.leadscout.email.provider.ContactIntelligenceService;
import com.mike.leadscout.email.provider.ProviderHit;
import com.mike.leadscout.email.provider.VerificationVerdict;
import com.mike.leadscout.util.Domains;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks the contact-intelligence providers in parallel and takes the best hit that survives
 * re-verification.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContactApiPhase implements CascadePhase {

    static final int MAX_VERIFIED_HITS = 3;

    private final ContactIntelligenceService intelligence;
    private final ConfidenceTable confidenceTable;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.CONTACT_API;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return lookup.hasDomain() && intelligence.hasSearchProvider();
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        List<ProviderHit> hits = intelligence.searchAll(lookup.getDomain()).stream()
                .filter(h -> Domains.emailMatchesDomain(h.email(), lookup.getDomain()))
                .filter(h -> EmailFilter.isAcceptable(h.email()))
                .toList();
        if (hits.isEmpty()) return null;

        double base = confidenceTable.base(DiscoveryPhase.CONTACT_API);
        double floor = confidenceTable.minAccept(DiscoveryPhase.CONTACT_API);
        int checked = 0;

        for (ProviderHit hit : hits) {
            if (checked >= MAX_VERIFIED_HITS) break;
            double confidence = hit.verified() ? Math.max(hit.confidence(), base) : hit.confidence();
            Boolean catchAll = null;

            if (intelligence.hasVerifier()) {
                checked++;
                VerificationVerdict verdict = intelligence.verify(hit.email());
                if (verdict != null && verdict.isDefinitive()) {
                    if (!verdict.isDeliverable()) {
                        log.info("ContactApiPhase: {} from {} failed verification ({})", hit.email(), hit.provider(), verdict.provider());
                        continue;
                    }
                    confidence = Math.max(confidence, verdict.confidence());
                    catchAll = verdict.isCatchAll() ? Boolean.TRUE : null;
                }
            }

            if (confidence >= floor) {
                return EmailCandidate.of(hit.email(), confidence, DiscoveryPhase.CONTACT_API, Evidence.API, hit.provider())
                        .withCatchAllHint(catchAll);
            }
        }
        return null;
    }
}
