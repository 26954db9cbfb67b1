package com.mike.leadscout.metrics;

import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.resilience.CircuitState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
@Slf4j
public class MicrometerLeadScoutMetrics implements LeadScoutMetrics {

    private final MeterRegistry registry;

    @Override
    public void sourceAttempt(String source) {
        registry.counter("lead.source.attempts", "source", source).increment();
    }

    @Override
    public void sourceSuccess(String source, long durationMs) {
        Timer.builder("lead.source.duration")
                .tag("source", source)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void sourceFailure(String source, Throwable error) {
        String type = error == null ? "unknown" : error.getClass().getSimpleName();
        registry.counter("lead.source.failures", "source", source, "error", type).increment();
    }

    @Override
    public void circuitStateChanged(String source, CircuitState from, CircuitState to) {
        log.info("MicrometerLeadScoutMetrics: circuit {} {} -> {}", source, from, to);
        registry.counter("lead.circuit.transitions", "source", source, "to", to.name()).increment();
    }

    @Override
    public void cacheLookup(boolean hit) {
        registry.counter("lead.cache.requests", "result", hit ? "hit" : "miss").increment();
    }

    @Override
    public void cacheError() {
        registry.counter("lead.cache.requests", "result", "error").increment();
    }

    @Override
    public void phaseHit(DiscoveryPhase phase) {
        registry.counter("lead.cascade.phase.hits", "phase", phase.label()).increment();
    }
}
