package com.mike.leadscout.email.provider;

import com.mike.leadscout.resilience.CircuitOpenException;
import com.mike.leadscout.resilience.JobCancelledException;
import com.mike.leadscout.resilience.LeadScoutException;
import com.mike.leadscout.resilience.SourceGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Fans a domain out to every enabled contact-intelligence provider and verifies single addresses
 * against the verification providers in preference order.
 */
@Service
@Slf4j
public class ContactIntelligenceService {

    static final List<String> VERIFIER_PREFERENCE = List.of(
            ZeroBounceClient.NAME, NeverBounceClient.NAME, HunterClient.NAME);

    private final List<ContactIntelligenceProvider> providers;
    private final List<EmailVerificationProvider> verifiers;
    private final SourceGuard guard;
    private final ExecutorService executor;

    public ContactIntelligenceService(List<ContactIntelligenceProvider> providers,
                                      List<EmailVerificationProvider> verifiers,
                                      SourceGuard guard,
                                      @Qualifier("externalCallExecutor") ExecutorService executor) {
        this.providers = List.copyOf(providers);
        this.verifiers = verifiers.stream()
                .sorted(Comparator.comparingInt(ContactIntelligenceService::preference))
                .toList();
        this.guard = guard;
        this.executor = executor;
    }

    public boolean hasSearchProvider() {
        return providers.stream().anyMatch(ContactIntelligenceProvider::isEnabled);
    }

    public boolean hasVerifier() {
        return verifiers.stream().anyMatch(EmailVerificationProvider::isEnabled);
    }

    /**
     * @return hits from all providers that answered, best confidence first
     */
    public List<ProviderHit> searchAll(String domain) {
        List<CompletableFuture<List<ProviderHit>>> futures = new ArrayList<>();
        for (ContactIntelligenceProvider provider : providers) {
            if (!provider.isEnabled()) continue;
            futures.add(CompletableFuture.supplyAsync(() -> searchOne(provider, domain), executor));
        }

        List<ProviderHit> hits = new ArrayList<>();
        for (CompletableFuture<List<ProviderHit>> future : futures) {
            try {
                hits.addAll(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof JobCancelledException cancelled) throw cancelled;
                log.warn("ContactIntelligenceService: provider search failed for {}: {}", domain, e.getMessage());
            }
        }
        hits.sort(Comparator.comparingDouble(ProviderHit::confidence).reversed());
        return hits;
    }

    /**
     * First definitive verdict wins; an UNKNOWN answer falls through to the next provider.
     *
     * @return the verdict, or null when no provider could decide
     */
    public VerificationVerdict verify(String email) {
        VerificationVerdict fallback = null;
        for (EmailVerificationProvider verifier : verifiers) {
            if (!verifier.isEnabled()) continue;
            try {
                VerificationVerdict verdict = guard.call("provider:" + verifier.name(), () -> verifier.verify(email));
                if (verdict == null) continue;
                if (verdict.isDefinitive()) return verdict;
                if (fallback == null) fallback = verdict;
            } catch (JobCancelledException e) {
                throw e;
            } catch (CircuitOpenException e) {
                log.info("ContactIntelligenceService: {} skipped, circuit open", verifier.name());
            } catch (LeadScoutException e) {
                log.warn("ContactIntelligenceService: {} failed to verify {}: {}", verifier.name(), email, e.getMessage());
            }
        }
        return fallback;
    }

    private List<ProviderHit> searchOne(ContactIntelligenceProvider provider, String domain) {
        try {
            List<ProviderHit> hits = guard.call("provider:" + provider.name(), () -> provider.search(domain));
            return hits == null ? List.of() : hits;
        } catch (CircuitOpenException e) {
            log.info("ContactIntelligenceService: {} skipped, circuit open", provider.name());
            return List.of();
        }
    }

    private static int preference(EmailVerificationProvider verifier) {
        int index = VERIFIER_PREFERENCE.indexOf(verifier.name());
        return index < 0 ? VERIFIER_PREFERENCE.size() : index;
    }
}
