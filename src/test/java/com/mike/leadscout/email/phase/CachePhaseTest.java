package com.mike.leadscout.email.phase;

import com.mike.leadscout.browser.BrowserSessionFactory;
import com.mike.leadscout.cache.CacheEntry;
import com.mike.leadscout.cache.CacheLookup;
import com.mike.leadscout.cache.EmailCache;
import com.mike.leadscout.cache.Freshness;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.verify.MailboxCheck;
import com.mike.leadscout.email.verify.MailboxVerification;
import com.mike.leadscout.email.verify.MailboxVerifier;
import com.mike.leadscout.quality.CanonicalBusiness;
import com.mike.leadscout.resilience.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CachePhaseTest {

    private EmailCache emailCache;
    private MailboxVerifier mailboxVerifier;
    private CachePhase phase;
    private EmailLookup lookup;

    @BeforeEach
    void setUp() {
        emailCache = mock(EmailCache.class);
        mailboxVerifier = mock(MailboxVerifier.class);
        phase = new CachePhase(emailCache, mailboxVerifier);
        CanonicalBusiness business = CanonicalBusiness.builder()
                .name("Acme Plumbing").website("https://acme.com").socialProfiles(Map.of()).build();
        lookup = new EmailLookup(business, "https://acme.com", false, mock(BrowserSessionFactory.class), CancellationToken.none());
    }

    private static CacheLookup cached(Freshness freshness) {
        CacheEntry entry = new CacheEntry("acme.com", "info@acme.com", 0.9, "website-crawl", true,
                Instant.parse("2026-01-01T00:00:00Z"));
        return new CacheLookup(entry, freshness);
    }

    @Test
    @DisplayName("fresh entry -> cached candidate carrying the stored catch-all flag")
    void fresh_hit() {
        //Arrange
        when(emailCache.lookup("acme.com")).thenReturn(cached(Freshness.FRESH));
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertEquals("info@acme.com", candidate.email());
        assertEquals(Evidence.CACHED, candidate.evidence());
        assertTrue(candidate.catchAllHint());
        verify(mailboxVerifier, never()).quickVerify(anyString());
    }

    @Test
    @DisplayName("aging entry whose domain lost its MX -> invalidated, nothing returned")
    void aging_without_mx_invalidated() {
        //Arrange
        when(emailCache.lookup("acme.com")).thenReturn(cached(Freshness.AGING));
        when(mailboxVerifier.quickVerify("info@acme.com"))
                .thenReturn(new MailboxVerification("info@acme.com", false, 0.2, MailboxCheck.NO_MX, false));
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertNull(candidate);
        verify(emailCache).invalidate("acme.com");
    }

    @Test
    @DisplayName("miss -> null")
    void miss() {
        assertNull(phase.attempt(lookup));
    }
}
