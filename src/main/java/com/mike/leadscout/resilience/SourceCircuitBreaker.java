package com.mike.leadscout.resilience;

import com.mike.leadscout.config.ResilienceProperties;
import com.mike.leadscout.metrics.LeadScoutMetrics;
import com.mike.leadscout.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-source breaker counting consecutive failures.
 * <ul>
 *     <li>closed -> open after {@code failureThreshold} consecutive failures</li>
 *     <li>open -> half-open on the first request once {@code resetTimeout} has passed since the last failure</li>
 *     <li>half-open -> closed after {@code halfOpenRequests} consecutive successes</li>
 *     <li>half-open -> open on any failure</li>
 * </ul>
 * State lives in the injected store so a host can share or persist it.
 */
@Component
@Slf4j
public class SourceCircuitBreaker {

    private final KeyValueStore<String, CircuitBreakerState> store;
    private final ResilienceProperties.Breaker config;
    private final LeadScoutMetrics metrics;
    private final Clock clock;

    public SourceCircuitBreaker(@Qualifier("circuitStore") KeyValueStore<String, CircuitBreakerState> store,
                                ResilienceProperties props,
                                LeadScoutMetrics metrics,
                                Clock clock) {
        this.store = store;
        this.config = props.breaker();
        this.metrics = metrics;
        this.clock = clock;
    }

    public synchronized boolean allowRequest(String source) {
        CircuitBreakerState current = load(source);
        switch (current.state()) {
            case CLOSED:
            case HALF_OPEN:
                return true;
            case OPEN:
            default:
                if (resetTimeoutElapsed(current)) {
                    transition(source, current, current.withState(CircuitState.HALF_OPEN).withSuccessCount(0));
                    return true;
                }
                return false;
        }
    }

    public synchronized void recordSuccess(String source) {
        CircuitBreakerState current = load(source);
        if (current.state() == CircuitState.HALF_OPEN) {
            int successes = current.successCount() + 1;
            if (successes >= Math.max(1, config.halfOpenRequests())) {
                transition(source, current, CircuitBreakerState.closed());
            } else {
                store.put(source, current.withSuccessCount(successes));
            }
            return;
        }
        if (current.state() == CircuitState.CLOSED && current.failures() > 0) {
            store.put(source, current.withFailures(0));
        }
    }

    public synchronized void recordFailure(String source) {
        CircuitBreakerState current = load(source);
        Instant now = clock.instant();
        CircuitBreakerState failed = current.withFailure(now);

        switch (current.state()) {
            case HALF_OPEN:
                transition(source, current, failed.withState(CircuitState.OPEN).withSuccessCount(0));
                break;
            case CLOSED:
                if (failed.failures() >= Math.max(1, config.failureThreshold())) {
                    transition(source, current, failed.withState(CircuitState.OPEN));
                } else {
                    store.put(source, failed);
                }
                break;
            case OPEN:
            default:
                store.put(source, failed);
        }
    }

    public synchronized CircuitState state(String source) {
        return load(source).state();
    }

    public synchronized CircuitBreakerState status(String source) {
        return load(source);
    }

    public Map<String, CircuitState> statuses() {
        Map<String, CircuitState> out = new TreeMap<>();
        store.snapshot().forEach((k, v) -> out.put(k, v.state()));
        return out;
    }

    public synchronized void reset(String source) {
        CircuitBreakerState current = load(source);
        if (current.state() != CircuitState.CLOSED) {
            transition(source, current, CircuitBreakerState.closed());
        } else {
            store.put(source, CircuitBreakerState.closed());
        }
    }

    private boolean resetTimeoutElapsed(CircuitBreakerState s) {
        if (s.lastFailureTime() == null) return true;
        Duration elapsed = Duration.between(s.lastFailureTime(), clock.instant());
        return elapsed.compareTo(config.resetTimeout()) >= 0;
    }

    private CircuitBreakerState load(String source) {
        CircuitBreakerState s = store.get(source);
        return s == null ? CircuitBreakerState.closed() : s;
    }

    private void transition(String source, CircuitBreakerState from, CircuitBreakerState to) {
        store.put(source, to);
        if (from.state() != to.state()) {
            log.info("SourceCircuitBreaker: {} {} -> {} (failures={})", source, from.state(), to.state(), from.failures());
            metrics.circuitStateChanged(source, from.state(), to.state());
        }
    }
}
