package com.mike.leadscout.listing;

/**
 * Receives {@code (message, fraction)} progress events between source completions.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (message, fraction) -> {
    };

    void onProgress(String message, double fraction);
}
