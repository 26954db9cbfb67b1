package com.mike.leadscout.resilience;

import org.springframework.web.client.RestClient;

public final class HttpErrors {

    private HttpErrors() {
    }

    /**
     * Status handler for {@code RestClient.retrieve().onStatus(...)}: 408/429/5xx become retryable,
     * every other error status (auth, quota, bad request) fails fast.
     */
    public static RestClient.ResponseSpec.ErrorHandler raise(String source) {
        return (request, response) -> {
            int status = response.getStatusCode().value();
            String message = source + " responded HTTP " + status + " for " + request.getURI().getPath();
            if (ErrorClassifier.isRetryableStatus(status)) {
                throw new RetryableSourceException(source, message);
            }
            throw new NonRetryableSourceException(source, message);
        };
    }
}
