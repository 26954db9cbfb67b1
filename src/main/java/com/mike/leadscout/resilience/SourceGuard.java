package com.mike.leadscout.resilience;

import com.mike.leadscout.config.ResilienceProperties;
import com.mike.leadscout.metrics.LeadScoutMetrics;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Runs one logical call against an external source: circuit check, per-attempt timeout, retry with backoff.
 * The breaker sees one outcome per logical call, not one per attempt.
 */
@Component
@Slf4j
public class SourceGuard {

    private final SourceCircuitBreaker breaker;
    private final RetryExecutor retryExecutor;
    private final ErrorClassifier classifier;
    private final LeadScoutMetrics metrics;
    private final ExecutorService externalCallExecutor;
    private final TimeLimiter timeLimiter;

    public SourceGuard(SourceCircuitBreaker breaker,
                       RetryExecutor retryExecutor,
                       ErrorClassifier classifier,
                       LeadScoutMetrics metrics,
                       @Qualifier("externalCallExecutor") ExecutorService externalCallExecutor,
                       ResilienceProperties props) {
        this.breaker = breaker;
        this.retryExecutor = retryExecutor;
        this.classifier = classifier;
        this.metrics = metrics;
        this.externalCallExecutor = externalCallExecutor;
        Duration timeout = props.callTimeout() == null ? Duration.ofSeconds(30) : props.callTimeout();
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    public <T> T call(String sourceKey, Callable<T> action) {
        return call(sourceKey, action, null);
    }

    public <T> T call(String sourceKey, Callable<T> action, RetryListener listener) {
        if (!breaker.allowRequest(sourceKey)) {
            log.info("SourceGuard: skipping {} (circuit open)", sourceKey);
            throw new CircuitOpenException(sourceKey);
        }

        metrics.sourceAttempt(sourceKey);
        long start = System.currentTimeMillis();
        try {
            T result = retryExecutor.execute(sourceKey, () -> timed(action), listener);
            breaker.recordSuccess(sourceKey);
            metrics.sourceSuccess(sourceKey, System.currentTimeMillis() - start);
            return result;
        } catch (RuntimeException e) {
            LeadScoutException wrapped = classifier.wrap(sourceKey, e);
            if (!(wrapped instanceof JobCancelledException)) {
                breaker.recordFailure(sourceKey);
                metrics.sourceFailure(sourceKey, wrapped.getCause() == null ? wrapped : wrapped.getCause());
            }
            throw wrapped;
        }
    }

    private <T> T timed(Callable<T> action) throws Exception {
        return timeLimiter.executeFutureSupplier(() -> externalCallExecutor.submit(action));
    }
}
