package com.mike.leadscout.resilience;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a required source failed or fewer sources than required succeeded.
 */
@Getter
public class PartialResultsException extends LeadScoutException {

    private final transient PartialResults<?> results;

    public PartialResultsException(String message, PartialResults<?> results) {
        super(message);
        this.results = results;
    }

    public List<String> getFailedSources() {
        return results.getFailedSources();
    }
}
