package com.mike.leadscout.resilience;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Nested
    @DisplayName("isRetryable")
    class IsRetryable {

        @Test
        @DisplayName("socket timeout -> retryable")
        void timeout_is_retryable() {
            assertTrue(classifier.isRetryable(new SocketTimeoutException("Read timed out")));
        }

        @Test
        @DisplayName("HTTP 429 and 503 -> retryable")
        void rate_limit_and_server_error_are_retryable() {
            assertTrue(classifier.isRetryable(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)));
            assertTrue(classifier.isRetryable(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE)));
        }

        @Test
        @DisplayName("HTTP 401 and 403 -> not retryable")
        void auth_errors_are_not_retryable() {
            assertFalse(classifier.isRetryable(new HttpClientErrorException(HttpStatus.UNAUTHORIZED)));
            assertFalse(classifier.isRetryable(new HttpClientErrorException(HttpStatus.FORBIDDEN)));
        }

        @Test
        @DisplayName("wrapped network failure -> retryable")
        void unwraps_completion_exception() {
            assertTrue(classifier.isRetryable(new CompletionException(new ResourceAccessException("I/O error"))));
        }

        @Test
        @DisplayName("validation failure -> not retryable")
        void validation_is_not_retryable() {
            assertFalse(classifier.isRetryable(new IllegalArgumentException("bad domain")));
        }

        @Test
        @DisplayName("open circuit -> not retryable")
        void circuit_open_is_not_retryable() {
            assertFalse(classifier.isRetryable(new CircuitOpenException("source:yelp")));
        }

        @Test
        @DisplayName("message hint -> retryable")
        void message_hint() {
            assertTrue(classifier.isRetryable(new IllegalStateException("Target closed while navigating")));
        }
    }

    @Nested
    @DisplayName("wrap")
    class Wrap {

        @Test
        @DisplayName("own exception -> kept as is")
        void wrap_keeps_own_exception() {
            //Arrange
            CircuitOpenException original = new CircuitOpenException("source:yelp");
            //Act
            LeadScoutException result = classifier.wrap("source:yelp", original);
            //Assert
            assertSame(original, result);
        }

        @Test
        @DisplayName("timeout -> RetryableSourceException with cause")
        void wrap_timeout() {
            //Arrange
            SocketTimeoutException cause = new SocketTimeoutException("Read timed out");
            //Act
            LeadScoutException result = classifier.wrap("source:yelp", cause);
            //Assert
            assertInstanceOf(RetryableSourceException.class, result);
            assertSame(cause, result.getCause());
        }

        @Test
        @DisplayName("auth failure -> NonRetryableSourceException")
        void wrap_auth() {
            //Act
            LeadScoutException result = classifier.wrap("provider:hunter",
                    new HttpClientErrorException(HttpStatus.UNAUTHORIZED));
            //Assert
            assertInstanceOf(NonRetryableSourceException.class, result);
        }
    }
}
