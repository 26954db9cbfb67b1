package com.mike.leadscout.resilience;

public class CircuitOpenException extends LeadScoutException {

    public CircuitOpenException(String source) {
        super(source, "Circuit open for source " + source, null);
    }
}
