package com.mike.leadscout.email.extract;

public record HarvestedEmail(
        String email,
        int priority,
        String extractor
) {
}
