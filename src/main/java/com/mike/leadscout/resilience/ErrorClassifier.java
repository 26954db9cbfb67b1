package com.mike.leadscout.resilience;

import com.microsoft.playwright.PlaywrightException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Splits failures into transient ones worth retrying (network, timeout, rate limit, 5xx, browser crash)
 * and permanent ones (validation, auth, permission, other 4xx).
 */
@Component
@Slf4j
public class ErrorClassifier {

    private static final List<String> RETRYABLE_HINTS = List.of(
            "timeout", "timed out", "econnreset", "econnrefused", "connection reset",
            "rate limit", "too many requests", "temporarily unavailable", "503", "502", "504",
            "target closed", "browser has been closed", "navigation failed"
    );

    public boolean isRetryable(Throwable error) {
        Throwable t = unwrap(error);
        if (t == null) return false;

        if (t instanceof NonRetryableSourceException || t instanceof CircuitOpenException
                || t instanceof JobCancelledException || t instanceof PartialResultsException) {
            return false;
        }
        if (t instanceof RetryableSourceException) return true;
        if (t instanceof IllegalArgumentException) return false;

        if (t instanceof RestClientResponseException rce) {
            return isRetryableStatus(rce.getStatusCode().value());
        }
        if (t instanceof HttpStatusException hse) {
            return isRetryableStatus(hse.getStatusCode());
        }
        if (t instanceof ResourceAccessException) return true;
        if (t instanceof TimeoutException || t instanceof SocketTimeoutException) return true;
        if (t instanceof ConnectException || t instanceof UnknownHostException) return true;
        if (t instanceof IOException) return true;
        if (t instanceof PlaywrightException) return true;

        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase(Locale.ROOT);
        return RETRYABLE_HINTS.stream().anyMatch(lower::contains);
    }

    public static boolean isRetryableStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Wraps a failure into the pipeline's own hierarchy, keeping already classified exceptions as they are.
     */
    public LeadScoutException wrap(String source, Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof LeadScoutException lse) return lse;
        String message = t == null ? "unknown failure" : t.getClass().getSimpleName() + ": " + t.getMessage();
        if (isRetryable(t)) {
            return new RetryableSourceException(source, message, t);
        }
        return new NonRetryableSourceException(source, message, t);
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
