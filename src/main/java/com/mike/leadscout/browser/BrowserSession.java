package com.mike.leadscout.browser;

import java.time.Duration;
import java.util.List;

/**
 * One headless page driven through a site. Implementations are not thread-safe;
 * a session belongs to a single cascade run.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * @return true when the page loaded with a non-error status
     * @throws com.mike.leadscout.resilience.LeadScoutException on network failure or timeout, classified retryable or not
     */
    boolean navigate(String url, Duration timeout);

    /**
     * Runs a script in the page. Returns null on backends without a script engine.
     */
    Object evaluate(String script);

    String content();

    String renderedText();

    List<String> frames();

    String currentUrl();

    String title();

    default PageSnapshot snapshot() {
        return new PageSnapshot(currentUrl(), content(), renderedText(), frames());
    }

    @Override
    void close();
}
