package com.mike.leadscout.resilience;

import java.time.Instant;

public record CircuitBreakerState(
        CircuitState state,
        int failures,
        Instant lastFailureTime,
        int successCount
) {
    public static CircuitBreakerState closed() {
        return new CircuitBreakerState(CircuitState.CLOSED, 0, null, 0);
    }

    public CircuitBreakerState withState(CircuitState newState) {
        return new CircuitBreakerState(newState, failures, lastFailureTime, successCount);
    }

    public CircuitBreakerState withFailure(Instant at) {
        return new CircuitBreakerState(state, failures + 1, at, successCount);
    }

    public CircuitBreakerState withSuccessCount(int count) {
        return new CircuitBreakerState(state, failures, lastFailureTime, count);
    }

    public CircuitBreakerState withFailures(int count) {
        return new CircuitBreakerState(state, count, lastFailureTime, successCount);
    }
}
