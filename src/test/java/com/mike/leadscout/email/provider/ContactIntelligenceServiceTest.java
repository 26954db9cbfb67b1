package com.mike.leadscout.email.provider;

import com.mike.leadscout.config.ResilienceProperties;
import com.mike.leadscout.metrics.LeadScoutMetrics;
import com.mike.leadscout.resilience.ErrorClassifier;
import com.mike.leadscout.resilience.NonRetryableSourceException;
import com.mike.leadscout.resilience.RetryExecutor;
import com.mike.leadscout.resilience.SourceCircuitBreaker;
import com.mike.leadscout.resilience.SourceGuard;
import com.mike.leadscout.store.CaffeineKeyValueStore;
import com.mike.leadscout.support.MutableClock;
import com.mike.leadscout.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContactIntelligenceServiceTest {

    private ExecutorService pool;
    private SourceGuard guard;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        ResilienceProperties props = TestProperties.fastResilience(0);
        ErrorClassifier classifier = new ErrorClassifier();
        LeadScoutMetrics metrics = mock(LeadScoutMetrics.class);
        SourceCircuitBreaker breaker = new SourceCircuitBreaker(CaffeineKeyValueStore.inMemory(), props, metrics,
                MutableClock.startingAt("2026-01-01T10:00:00Z"));
        guard = new SourceGuard(breaker, new RetryExecutor(classifier, props), classifier, metrics, pool, props);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static ContactIntelligenceProvider provider(String name, boolean enabled) {
        ContactIntelligenceProvider p = mock(ContactIntelligenceProvider.class);
        when(p.name()).thenReturn(name);
        when(p.isEnabled()).thenReturn(enabled);
        return p;
    }

    private static EmailVerificationProvider verifier(String name) {
        EmailVerificationProvider v = mock(EmailVerificationProvider.class);
        when(v.name()).thenReturn(name);
        when(v.isEnabled()).thenReturn(true);
        return v;
    }

    @Nested
    @DisplayName("searchAll")
    class SearchAll {

        @Test
        @DisplayName("one provider failing -> hits of the others, best confidence first")
        void failing_provider_skipped() {
            //Arrange
            ContactIntelligenceProvider hunter = provider(HunterClient.NAME, true);
            ContactIntelligenceProvider apollo = provider(ApolloClient.NAME, true);
            ContactIntelligenceProvider disabled = provider("other", false);
            when(hunter.search("acme.com")).thenReturn(List.of(
                    new ProviderHit("jane@acme.com", 0.7, HunterClient.NAME, false),
                    new ProviderHit("info@acme.com", 0.92, HunterClient.NAME, true)));
            when(apollo.search("acme.com")).thenThrow(new NonRetryableSourceException(ApolloClient.NAME, "HTTP 401"));
            ContactIntelligenceService service = new ContactIntelligenceService(
                    List.of(hunter, apollo, disabled), List.of(), guard, pool);
            //Act
            List<ProviderHit> hits = service.searchAll("acme.com");
            //Assert
            assertEquals(2, hits.size());
            assertEquals("info@acme.com", hits.get(0).email());
            verify(disabled, never()).search("acme.com");
        }

        @Test
        @DisplayName("no enabled provider -> nothing to search")
        void none_enabled() {
            //Arrange
            ContactIntelligenceService service = new ContactIntelligenceService(
                    List.of(provider(HunterClient.NAME, false)), List.of(), guard, pool);
            //Assert
            assertFalse(service.hasSearchProvider());
            assertTrue(service.searchAll("acme.com").isEmpty());
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("ZeroBounce is asked before Hunter regardless of bean order")
        void preference_order() {
            //Arrange
            EmailVerificationProvider hunter = verifier(HunterClient.NAME);
            EmailVerificationProvider zeroBounce = verifier(ZeroBounceClient.NAME);
            when(zeroBounce.verify("info@acme.com")).thenReturn(
                    new VerificationVerdict("info@acme.com", VerificationVerdict.Status.VALID, 0.98, ZeroBounceClient.NAME));
            ContactIntelligenceService service = new ContactIntelligenceService(
                    List.of(), List.of(hunter, zeroBounce), guard, pool);
            //Act
            VerificationVerdict verdict = service.verify("info@acme.com");
            //Assert
            assertEquals(ZeroBounceClient.NAME, verdict.provider());
            verify(hunter, never()).verify("info@acme.com");
        }

        @Test
        @DisplayName("unknown answer falls through; a failing verifier is skipped")
        void unknown_falls_through() {
            //Arrange
            EmailVerificationProvider zeroBounce = verifier(ZeroBounceClient.NAME);
            EmailVerificationProvider neverBounce = verifier(NeverBounceClient.NAME);
            EmailVerificationProvider hunter = verifier(HunterClient.NAME);
            when(zeroBounce.verify("jane@acme.com")).thenReturn(
                    new VerificationVerdict("jane@acme.com", VerificationVerdict.Status.UNKNOWN, 0.55, ZeroBounceClient.NAME));
            when(neverBounce.verify("jane@acme.com")).thenThrow(new NonRetryableSourceException(NeverBounceClient.NAME, "HTTP 402"));
            when(hunter.verify("jane@acme.com")).thenReturn(
                    new VerificationVerdict("jane@acme.com", VerificationVerdict.Status.INVALID, 0.1, HunterClient.NAME));
            ContactIntelligenceService service = new ContactIntelligenceService(
                    List.of(), List.of(zeroBounce, neverBounce, hunter), guard, pool);
            //Act
            VerificationVerdict verdict = service.verify("jane@acme.com");
            //Assert
            assertEquals(VerificationVerdict.Status.INVALID, verdict.status());
            assertEquals(HunterClient.NAME, verdict.provider());
        }

        @Test
        @DisplayName("only unknown answers -> first unknown verdict; none at all -> null")
        void only_unknown() {
            //Arrange
            EmailVerificationProvider zeroBounce = verifier(ZeroBounceClient.NAME);
            when(zeroBounce.verify("jane@acme.com")).thenReturn(
                    new VerificationVerdict("jane@acme.com", VerificationVerdict.Status.UNKNOWN, 0.55, ZeroBounceClient.NAME));
            ContactIntelligenceService service = new ContactIntelligenceService(
                    List.of(), List.of(zeroBounce), guard, pool);
            ContactIntelligenceService empty = new ContactIntelligenceService(List.of(), List.of(), guard, pool);
            //Act
            VerificationVerdict verdict = service.verify("jane@acme.com");
            //Assert
            assertEquals(VerificationVerdict.Status.UNKNOWN, verdict.status());
            assertNull(empty.verify("jane@acme.com"));
        }
    }
}
