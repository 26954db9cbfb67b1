package com.mike.leadscout.resilience;

public class RetryableSourceException extends LeadScoutException {

    public RetryableSourceException(String source, String message) {
        super(source, message, null);
    }

    public RetryableSourceException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
