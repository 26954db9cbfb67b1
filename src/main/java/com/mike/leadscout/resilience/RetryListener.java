package com.mike.leadscout.resilience;

import java.time.Duration;

@FunctionalInterface
public interface RetryListener {

    void onRetry(String name, int attempt, Throwable error, Duration wait);
}
