package com.mike.leadscout.email.phase;

import com.mike.leadscout.browser.BrowserSessionFactory;
import com.mike.leadscout.config.CascadeProperties;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.provider.ContactIntelligenceService;
import com.mike.leadscout.email.provider.VerificationVerdict;
import com.mike.leadscout.email.verify.MailboxCheck;
import com.mike.leadscout.email.verify.MailboxVerification;
import com.mike.leadscout.email.verify.MailboxVerifier;
import com.mike.leadscout.email.verify.MxLookUp;
import com.mike.leadscout.quality.CanonicalBusiness;
import com.mike.leadscout.resilience.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeneratedFallbackPhaseTest {

    private ExecutorService pool;
    private ContactIntelligenceService intelligence;
    private MailboxVerifier mailboxVerifier;
    private MxLookUp mxLookUp;
    private GeneratedFallbackPhase phase;
    private EmailLookup lookup;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        intelligence = mock(ContactIntelligenceService.class);
        mailboxVerifier = mock(MailboxVerifier.class);
        mxLookUp = mock(MxLookUp.class);
        when(mailboxVerifier.verify(anyString())).thenAnswer(inv -> new MailboxVerification(
                inv.getArgument(0), true, 0.7, MailboxCheck.INCONCLUSIVE, true));
        phase = new GeneratedFallbackPhase(intelligence, mailboxVerifier, mxLookUp, ConfidenceTable.defaults(), pool);
        CanonicalBusiness business = CanonicalBusiness.builder()
                .name("Acme Plumbing").website("https://acme.com").socialProfiles(Map.of()).build();
        lookup = new EmailLookup(business, "https://acme.com", false, mock(BrowserSessionFactory.class), CancellationToken.none());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("no mail exchanger -> nothing generated")
    void no_mx() {
        //Arrange
        when(mxLookUp.checkDomain("acme.com")).thenReturn(MxLookUp.MxStatus.INVALID);
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertNull(candidate);
        verify(mailboxVerifier, never()).verify(anyString());
    }

    @Test
    @DisplayName("nothing confirmed, MX valid -> info@ at the phase base confidence")
    void mx_valid_fallback() {
        //Arrange
        when(mxLookUp.checkDomain("acme.com")).thenReturn(MxLookUp.MxStatus.VALID);
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertEquals("info@acme.com", candidate.email());
        assertEquals(0.6, candidate.confidence(), 1e-9);
        assertEquals("generated:mx-valid", candidate.source());
    }

    @Test
    @DisplayName("DNS could not answer -> info@ unverified at 0.5")
    void mx_unknown_fallback() {
        //Arrange
        when(mxLookUp.checkDomain("acme.com")).thenReturn(MxLookUp.MxStatus.UNKNOWN);
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertEquals("info@acme.com", candidate.email());
        assertEquals(0.5, candidate.confidence(), 1e-9);
        assertEquals("generated:unverified", candidate.source());
    }

    @Test
    @DisplayName("verifier confirms contact@ -> contact@ with the verifier's confidence")
    void verifier_confirms_inbox() {
        //Arrange
        when(mxLookUp.checkDomain("acme.com")).thenReturn(MxLookUp.MxStatus.VALID);
        when(intelligence.hasVerifier()).thenReturn(true);
        when(intelligence.verify("info@acme.com")).thenReturn(
                new VerificationVerdict("info@acme.com", VerificationVerdict.Status.INVALID, 0.05, "zerobounce"));
        when(intelligence.verify("contact@acme.com")).thenReturn(
                new VerificationVerdict("contact@acme.com", VerificationVerdict.Status.VALID, 0.98, "zerobounce"));
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertEquals("contact@acme.com", candidate.email());
        assertEquals(0.98, candidate.confidence(), 1e-9);
        assertEquals("generated:verified/zerobounce", candidate.source());
    }

    @Test
    @DisplayName("SMTP accepts office@ -> office@ at the SMTP-confirmed tier")
    void smtp_confirms_inbox() {
        //Arrange
        when(mxLookUp.checkDomain("acme.com")).thenReturn(MxLookUp.MxStatus.VALID);
        when(mailboxVerifier.verify("office@acme.com")).thenReturn(
                new MailboxVerification("office@acme.com", true, 0.95, MailboxCheck.PASSED, true));
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertEquals("office@acme.com", candidate.email());
        assertEquals(0.85, candidate.confidence(), 1e-9);
        assertEquals("generated:verified/smtp", candidate.source());
    }

    @Test
    @DisplayName("configured SMTP-confirmed and unverified tiers are used")
    void configured_tiers() {
        //Arrange
        CascadeProperties props = new CascadeProperties();
        props.setGeneratedSmtpConfirmed(0.83);
        props.setGeneratedUnverified(0.45);
        GeneratedFallbackPhase custom = new GeneratedFallbackPhase(intelligence, mailboxVerifier, mxLookUp,
                new ConfidenceTable(props), pool);
        when(mxLookUp.checkDomain("acme.com")).thenReturn(MxLookUp.MxStatus.UNKNOWN);
        //Act
        EmailCandidate unverified = custom.attempt(lookup);
        when(mailboxVerifier.verify("hello@acme.com")).thenReturn(
                new MailboxVerification("hello@acme.com", true, 0.95, MailboxCheck.PASSED, true));
        EmailCandidate confirmed = custom.attempt(lookup);
        //Assert
        assertEquals(0.45, unverified.confidence(), 1e-9);
        assertEquals("hello@acme.com", confirmed.email());
        assertEquals(0.83, confirmed.confidence(), 1e-9);
    }

    @Test
    @DisplayName("first confirmed inbox interrupts the checks still running")
    void confirmed_inbox_cancels_remaining_checks() throws InterruptedException {
        //Arrange
        when(mxLookUp.checkDomain("acme.com")).thenReturn(MxLookUp.MxStatus.VALID);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(mailboxVerifier.verify("info@acme.com")).thenAnswer(inv -> {
            started.await(5, TimeUnit.SECONDS);
            return new MailboxVerification("info@acme.com", true, 0.95, MailboxCheck.PASSED, true);
        });
        when(mailboxVerifier.verify("contact@acme.com")).thenAnswer(inv -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return new MailboxVerification("contact@acme.com", true, 0.7, MailboxCheck.INCONCLUSIVE, true);
        });
        //Act
        EmailCandidate candidate = phase.attempt(lookup);
        //Assert
        assertEquals("info@acme.com", candidate.email());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }
}
