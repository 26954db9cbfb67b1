package com.mike.leadscout.email.phase;

import com.mike.leadscout.browser.BrowserSession;
import com.mike.leadscout.browser.PageSnapshot;
import com.mike.leadscout.config.CascadeProperties;
import com.mike.leadscout.crawl.NameExtractor;
import com.mike.leadscout.crawl.PersonName;
import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.provider.ContactIntelligenceService;
import com.mike.leadscout.email.provider.VerificationVerdict;
import com.mike.leadscout.email.verify.MailboxCheck;
import com.mike.leadscout.email.verify.MailboxVerification;
import com.mike.leadscout.email.verify.MailboxVerifier;
import com.mike.leadscout.email.verify.NameGuess;
import com.mike.leadscout.email.verify.PatternLearner;
import com.mike.leadscout.resilience.LeadScoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Guesses personal addresses from owner and staff names found on the site. A guess is accepted
 * only when a verification API or the mail server confirms it; confirmed guesses teach the
 * domain's pattern.
 */
@Component
@Slf4j
public class NamePermutationPhase implements CascadePhase {

    static final int MAX_GUESSES = 12;

    private final NameExtractor nameExtractor;
    private final PatternLearner patternLearner;
    private final ContactIntelligenceService intelligence;
    private final MailboxVerifier mailboxVerifier;
    private final ConfidenceTable confidenceTable;
    private final Duration pageTimeout;

    public NamePermutationPhase(NameExtractor nameExtractor,
                                PatternLearner patternLearner,
                                ContactIntelligenceService intelligence,
                                MailboxVerifier mailboxVerifier,
                                ConfidenceTable confidenceTable,
                                CascadeProperties props) {
        this.nameExtractor = nameExtractor;
        this.patternLearner = patternLearner;
        this.intelligence = intelligence;
        this.mailboxVerifier = mailboxVerifier;
        this.confidenceTable = confidenceTable;
        this.pageTimeout = props.getCrawl().getPageTimeout();
    }

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.NAME_PERMUTATION;
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        List<PersonName> names = nameExtractor.extract(pages(lookup));
        if (names.isEmpty()) return null;
        log.info("NamePermutationPhase: {} candidate names on {}", names.size(), lookup.getDomain());

        String domain = lookup.getDomain();
        int tried = 0;
        for (PersonName name : names) {
            for (NameGuess guess : patternLearner.variations(domain, name.first(), name.last())) {
                if (tried++ >= MAX_GUESSES) return null;
                lookup.getToken().throwIfCancelled();

                double boost = patternLearner.boost(domain, guess.pattern());
                VerificationVerdict verdict = intelligence.hasVerifier() ? intelligence.verify(guess.email()) : null;
                if (verdict != null && verdict.isDefinitive()) {
                    if (!verdict.isDeliverable()) continue;
                    return confirmed(guess, name, domain, confidenceTable.permutationConfidence(boost),
                            verdict.provider(), verdict.isCatchAll() ? Boolean.TRUE : null);
                }

                MailboxVerification check = mailboxVerifier.verify(guess.email());
                if (check.check() == MailboxCheck.NO_MX) return null;
                if (check.check() == MailboxCheck.PASSED) {
                    return confirmed(guess, name, domain, confidenceTable.permutationConfidence(boost), "smtp", null);
                }
                if (check.check() == MailboxCheck.INCONCLUSIVE && !intelligence.hasVerifier()) {
                    log.debug("NamePermutationPhase: no way to confirm guesses on {}", domain);
                    return null;
                }
            }
        }
        return null;
    }

    private EmailCandidate confirmed(NameGuess guess, PersonName name, String domain,
                                     double confidence, String via, Boolean catchAll) {
        patternLearner.learn(domain, guess.email(), name.first(), name.last());
        return EmailCandidate.of(guess.email(), confidence, phase(), Evidence.PATTERN,
                        guess.pattern().label() + "/" + via)
                .withCatchAllHint(catchAll);
    }

    private List<PageSnapshot> pages(EmailLookup lookup) {
        List<PageSnapshot> pages = lookup.getCrawlState().pages();
        if (!pages.isEmpty()) return pages;
        try {
            BrowserSession session = lookup.session();
            if (session.navigate(lookup.getBaseUrl(), pageTimeout)) {
                PageSnapshot home = session.snapshot();
                lookup.getCrawlState().keepPage(home);
                return List.of(home);
            }
        } catch (LeadScoutException e) {
            log.info("NamePermutationPhase: cannot load {}: {}", lookup.getBaseUrl(), e.getMessage());
        }
        return List.of();
    }
}
