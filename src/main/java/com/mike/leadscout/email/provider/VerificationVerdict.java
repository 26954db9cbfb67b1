package com.mike.leadscout.email.provider;

public record VerificationVerdict(
        String email,
        Status status,
        double confidence,
        String provider
) {
    public enum Status {
        VALID, INVALID, CATCH_ALL, UNKNOWN
    }

    public boolean isDeliverable() {
        return status == Status.VALID || status == Status.CATCH_ALL;
    }

    public boolean isCatchAll() {
        return status == Status.CATCH_ALL;
    }

    public boolean isDefinitive() {
        return status != Status.UNKNOWN;
    }
}
