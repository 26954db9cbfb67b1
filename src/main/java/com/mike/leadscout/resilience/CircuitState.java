package com.mike.leadscout.resilience;

public enum CircuitState {
    CLOSED, OPEN, HALF_OPEN
}
