package com.mike.leadscout.email.verify;

import java.time.Instant;

public record LearnedPattern(
        EmailPattern pattern,
        int confirmations,
        Instant lastConfirmed
) {
}
