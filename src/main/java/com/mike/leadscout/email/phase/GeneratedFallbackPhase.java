package com.mike.leadscout.email.phase;

import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.provider.ContactIntelligenceService;
import com.mike.leadscout.email.provider.VerificationVerdict;
import com.mike.leadscout.email.verify.MailboxVerification;
import com.mike.leadscout.email.verify.MailboxVerifier;
import com.mike.leadscout.email.verify.MxLookUp;
import com.mike.leadscout.resilience.JobCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Last resort: common role inboxes on the domain, checked in parallel. The first confirmed inbox
 * in prefix order wins and the checks still running are cancelled. Otherwise info@ is returned at
 * the lowest tiers: the phase base when MX is valid, the unverified tier when DNS could not answer.
 * A domain without a mail exchanger gets nothing.
 */
@Component
@Slf4j
public class GeneratedFallbackPhase implements CascadePhase {

    static final List<String> PREFIXES = List.of("info", "contact", "hello", "office", "mail");

    private final ContactIntelligenceService intelligence;
    private final MailboxVerifier mailboxVerifier;
    private final MxLookUp mxLookUp;
    private final ConfidenceTable confidenceTable;
    private final ExecutorService executor;

    public GeneratedFallbackPhase(ContactIntelligenceService intelligence,
                                  MailboxVerifier mailboxVerifier,
                                  MxLookUp mxLookUp,
                                  ConfidenceTable confidenceTable,
                                  @Qualifier("externalCallExecutor") ExecutorService executor) {
        this.intelligence = intelligence;
        this.mailboxVerifier = mailboxVerifier;
        this.mxLookUp = mxLookUp;
        this.confidenceTable = confidenceTable;
        this.executor = executor;
    }

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.GENERATED;
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        String domain = lookup.getDomain();
        MxLookUp.MxStatus mx = mxLookUp.checkDomain(domain);
        if (mx == MxLookUp.MxStatus.INVALID) {
            log.info("GeneratedFallbackPhase: {} has no mail exchanger", domain);
            return null;
        }

        List<Future<EmailCandidate>> futures = new ArrayList<>();
        for (String prefix : PREFIXES) {
            String email = prefix + "@" + domain;
            futures.add(executor.submit(() -> confirm(email)));
        }

        try {
            for (Future<EmailCandidate> future : futures) {
                EmailCandidate confirmed;
                try {
                    confirmed = future.get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof JobCancelledException cancelled) throw cancelled;
                    log.warn("GeneratedFallbackPhase: check failed on {}: {}", domain,
                            e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                    continue;
                }
                if (confirmed != null) return confirmed;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted while checking role inboxes on " + domain);
        } finally {
            futures.forEach(f -> f.cancel(true));
        }

        String info = PREFIXES.get(0) + "@" + domain;
        if (mx == MxLookUp.MxStatus.VALID) {
            return EmailCandidate.of(info, confidenceTable.base(phase()), phase(), Evidence.PATTERN, "mx-valid");
        }
        return EmailCandidate.of(info, confidenceTable.generatedUnverified(), phase(), Evidence.PATTERN, "unverified");
    }

    private EmailCandidate confirm(String email) {
        if (intelligence.hasVerifier()) {
            VerificationVerdict verdict = intelligence.verify(email);
            if (verdict != null && verdict.isDefinitive()) {
                if (!verdict.isDeliverable()) return null;
                return EmailCandidate.of(email, verdict.confidence(), phase(), Evidence.PATTERN, "verified/" + verdict.provider())
                        .withCatchAllHint(verdict.isCatchAll() ? Boolean.TRUE : null);
            }
        }
        MailboxVerification check = mailboxVerifier.verify(email);
        if (check.smtpAccepted()) {
            return EmailCandidate.of(email, confidenceTable.generatedConfirmed(), phase(), Evidence.PATTERN, "verified/smtp");
        }
        return null;
    }
}
