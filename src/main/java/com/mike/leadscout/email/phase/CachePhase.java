package com.mike.leadscout.email.phase;

import com.mike.leadscout.cache.CacheLookup;
import com.mike.leadscout.cache.EmailCache;
import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.verify.MailboxVerification;
import com.mike.leadscout.email.verify.MailboxVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reuses an earlier result for the domain. Aging entries are re-checked against DNS first
 * and dropped when the mail domain no longer resolves.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CachePhase implements CascadePhase {

    private final EmailCache emailCache;
    private final MailboxVerifier mailboxVerifier;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.CACHE;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return lookup.getDomain() != null;
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        CacheLookup cached = emailCache.lookup(lookup.getDomain());
        if (cached == null) return null;

        String email = cached.entry().email();
        if (cached.shouldReverify()) {
            MailboxVerification check = mailboxVerifier.quickVerify(email);
            if (!check.mxValid()) {
                log.info("CachePhase: cached {} for {} no longer has MX, invalidating", email, lookup.getDomain());
                emailCache.invalidate(lookup.getDomain());
                return null;
            }
        }

        log.info("CachePhase: {} -> {} ({}, confidence={})",
                lookup.getDomain(), email, cached.freshness(), cached.entry().confidence());
        return new EmailCandidate(email, cached.entry().confidence(), DiscoveryPhase.CACHE, Evidence.CACHED,
                cached.entry().source(), cached.entry().catchAll());
    }
}
