package com.mike.leadscout.resilience;

import com.mike.leadscout.config.ResilienceProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Retry with exponential backoff and jitter. Only failures the {@link ErrorClassifier} calls retryable
 * are retried; anything else fails after the first call.
 */
@Component
@Slf4j
public class RetryExecutor {

    private final ErrorClassifier classifier;
    private final RetryConfig config;

    public RetryExecutor(ErrorClassifier classifier, ResilienceProperties props) {
        this.classifier = classifier;
        this.config = buildConfig(props.retry(), classifier);
    }

    public <T> T execute(String name, Callable<T> action) {
        return execute(name, action, null);
    }

    public <T> T execute(String name, Callable<T> action, RetryListener listener) {
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> {
            Throwable last = event.getLastThrowable();
            log.warn("RetryExecutor: retry {} for {} in {} ms: {}",
                    event.getNumberOfRetryAttempts(), name, event.getWaitInterval().toMillis(),
                    last == null ? "n/a" : last.getMessage());
            if (listener != null) {
                listener.onRetry(name, event.getNumberOfRetryAttempts(), last, event.getWaitInterval());
            }
        });

        try {
            return Retry.decorateCallable(retry, action).call();
        } catch (Exception e) {
            throw classifier.wrap(name, e);
        }
    }

    static RetryConfig buildConfig(ResilienceProperties.Retry retry, ErrorClassifier classifier) {
        long initialMs = Math.max(1, toMillis(retry.initialDelay(), 1000));
        long maxMs = Math.max(initialMs, toMillis(retry.maxDelay(), 30_000));
        double multiplier = Math.max(1.0, retry.multiplier());
        double jitter = Math.min(0.99, Math.max(0.0, retry.jitter()));

        return RetryConfig.custom()
                .maxAttempts(Math.max(0, retry.maxRetries()) + 1)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(initialMs, multiplier, jitter, maxMs))
                .retryOnException(classifier::isRetryable)
                .build();
    }

    private static long toMillis(Duration d, long fallback) {
        return d == null ? fallback : d.toMillis();
    }
}
