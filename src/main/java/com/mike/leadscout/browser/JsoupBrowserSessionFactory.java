package com.mike.leadscout.browser;

import com.mike.leadscout.config.BrowserProperties;
import com.mike.leadscout.resilience.ErrorClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "leadscout.browser", name = "backend", havingValue = "jsoup", matchIfMissing = true)
@RequiredArgsConstructor
public class JsoupBrowserSessionFactory implements BrowserSessionFactory {

    private final BrowserProperties props;
    private final ErrorClassifier classifier;

    @Override
    public BrowserSession open() {
        return new JsoupBrowserSession(props, classifier);
    }
}
