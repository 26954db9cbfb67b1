package com.mike.leadscout.email.verify;

public record NameGuess(
        EmailPattern pattern,
        String email
) {
}
