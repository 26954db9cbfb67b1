package com.mike.leadscout.resilience;

public class NonRetryableSourceException extends LeadScoutException {

    public NonRetryableSourceException(String source, String message) {
        super(source, message, null);
    }

    public NonRetryableSourceException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
