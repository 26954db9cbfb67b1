package com.mike.leadscout.email.provider;

import java.util.List;

/**
 * Third-party service that knows addresses for a domain.
 */
public interface ContactIntelligenceProvider {

    String name();

    boolean isEnabled();

    /**
     * @throws com.mike.leadscout.resilience.LeadScoutException on transport or API failure
     */
    List<ProviderHit> search(String domain);
}
