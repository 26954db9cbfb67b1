package com.mike.leadscout.email.provider;

public record ProviderHit(
        String email,
        double confidence,
        String provider,
        boolean verified
) {
}
