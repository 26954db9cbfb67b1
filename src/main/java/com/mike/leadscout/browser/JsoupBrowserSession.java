package com.mike.leadscout.browser;

import com.mike.leadscout.config.BrowserProperties;
import com.mike.leadscout.resilience.ErrorClassifier;
import com.mike.leadscout.util.Domains;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain HTTP fetch + parse. No script engine: {@link #evaluate(String)} returns null and the
 * rendered text is the text of the served markup.
 */
@Slf4j
public class JsoupBrowserSession implements BrowserSession {

    private static final String REFERRER = "https://www.google.com";
    private static final int MAX_FRAMES = 3;

    private final BrowserProperties props;
    private final ErrorClassifier classifier;

    private String currentUrl;
    private String body = "";
    private Document document;
    private boolean html;

    public JsoupBrowserSession(BrowserProperties props, ErrorClassifier classifier) {
        this.props = props;
        this.classifier = classifier;
    }

    @Override
    public boolean navigate(String url, Duration timeout) {
        Connection.Response res;
        try {
            res = connect(url, timeout).execute();
        } catch (IOException e) {
            throw classifier.wrap(url, e);
        }

        currentUrl = res.url().toString();
        if (res.statusCode() >= 400) {
            log.debug("JsoupBrowserSession: {} -> HTTP {}", url, res.statusCode());
            body = "";
            document = Jsoup.parse("", currentUrl);
            return false;
        }

        body = res.body();
        String contentType = res.contentType();
        html = contentType == null || contentType.contains("html") || contentType.contains("xml");
        document = Jsoup.parse(body, currentUrl);
        return true;
    }

    @Override
    public Object evaluate(String script) {
        return null;
    }

    @Override
    public String content() {
        return body;
    }

    @Override
    public String renderedText() {
        if (document == null) return "";
        if (!html) return body;
        return document.body() == null ? "" : document.body().text();
    }

    @Override
    public List<String> frames() {
        List<String> out = new ArrayList<>();
        if (document == null || !html) return out;

        for (Element iframe : document.select("iframe[src]")) {
            if (out.size() >= MAX_FRAMES) break;
            String src = iframe.absUrl("src");
            if (src.isBlank() || !Domains.isSameDomain(currentUrl, src)) continue;
            try {
                out.add(connect(src, props.navigationTimeout()).get().outerHtml());
            } catch (IOException e) {
                log.debug("JsoupBrowserSession: frame {} failed: {}", src, e.getMessage());
            }
        }
        return out;
    }

    @Override
    public String currentUrl() {
        return currentUrl;
    }

    @Override
    public String title() {
        return document == null ? "" : document.title();
    }

    @Override
    public void close() {
        document = null;
        body = "";
    }

    private Connection connect(String url, Duration timeout) {
        Duration t = timeout != null ? timeout : props.navigationTimeout();
        return Jsoup.connect(url)
                .userAgent(props.effectiveUserAgent())
                .referrer(REFERRER)
                .timeout(t == null ? 10_000 : (int) t.toMillis())
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true);
    }
}
