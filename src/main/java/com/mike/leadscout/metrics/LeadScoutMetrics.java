package com.mike.leadscout.metrics;

import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.resilience.CircuitState;

public interface LeadScoutMetrics {

    void sourceAttempt(String source);

    void sourceSuccess(String source, long durationMs);

    void sourceFailure(String source, Throwable error);

    void circuitStateChanged(String source, CircuitState from, CircuitState to);

    void cacheLookup(boolean hit);

    void cacheError();

    void phaseHit(DiscoveryPhase phase);
}
