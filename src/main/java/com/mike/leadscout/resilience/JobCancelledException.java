package com.mike.leadscout.resilience;

public class JobCancelledException extends LeadScoutException {

    public JobCancelledException(String message) {
        super(message);
    }
}
