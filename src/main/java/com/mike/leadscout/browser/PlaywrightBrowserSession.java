package com.mike.leadscout.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Frame;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import com.mike.leadscout.config.BrowserProperties;
import com.mike.leadscout.resilience.ErrorClassifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.microsoft.playwright.options.LoadState.NETWORKIDLE;

@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {

    private static final double NETWORK_IDLE_TIMEOUT_MS = 5000;

    /**
     * Opens collapsed accordions, tabs and "show more" toggles so hidden contact blocks render.
     */
    private static final String EXPAND_HIDDEN_SCRIPT = """
            () => {
              document.querySelectorAll('details:not([open])').forEach(d => d.setAttribute('open', ''));
              document.querySelectorAll('[aria-expanded="false"]').forEach(el => {
                try { el.click(); } catch (e) { }
              });
              document.querySelectorAll('.collapse:not(.show), .accordion-collapse').forEach(el => el.classList.add('show'));
              return true;
            }
            """;

    private static final String INNER_TEXT_SCRIPT = "() => document.body ? document.body.innerText : ''";

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final ErrorClassifier classifier;

    public PlaywrightBrowserSession(BrowserProperties props, ErrorClassifier classifier) {
        this.classifier = classifier;
        this.playwright = Playwright.create();
        this.browser = playwright.chromium().launch(
                new BrowserType.LaunchOptions()
                        .setHeadless(props.headless())
                        .setArgs(List.of("--no-sandbox", "--disable-dev-shm-usage"))
        );
        this.context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(props.effectiveUserAgent())
                .setLocale("en-US"));
        this.page = context.newPage();
        if (props.navigationTimeout() != null) {
            page.setDefaultTimeout(props.navigationTimeout().toMillis());
            page.setDefaultNavigationTimeout(props.navigationTimeout().toMillis());
        }
    }

    @Override
    public boolean navigate(String url, Duration timeout) {
        Response response;
        try {
            Page.NavigateOptions options = new Page.NavigateOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED);
            if (timeout != null) options.setTimeout(timeout.toMillis());
            response = page.navigate(url, options);
        } catch (PlaywrightException e) {
            throw classifier.wrap(url, e);
        }

        try {
            page.waitForLoadState(NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(NETWORK_IDLE_TIMEOUT_MS));
        } catch (PlaywrightException e) {
            log.debug("PlaywrightBrowserSession: network not idle on {}: {}", url, e.getMessage());
        }

        try {
            page.evaluate(EXPAND_HIDDEN_SCRIPT);
        } catch (PlaywrightException e) {
            log.debug("PlaywrightBrowserSession: expand script failed on {}: {}", url, e.getMessage());
        }

        return response == null || response.status() < 400;
    }

    @Override
    public Object evaluate(String script) {
        try {
            return page.evaluate(script);
        } catch (PlaywrightException e) {
            throw classifier.wrap(page.url(), e);
        }
    }

    @Override
    public String content() {
        return page.content();
    }

    @Override
    public String renderedText() {
        Object text = evaluate(INNER_TEXT_SCRIPT);
        return text == null ? "" : text.toString();
    }

    @Override
    public List<String> frames() {
        List<String> out = new ArrayList<>();
        Frame main = page.mainFrame();
        for (Frame frame : page.frames()) {
            if (frame == main) continue;
            try {
                out.add(frame.content());
            } catch (PlaywrightException e) {
                log.debug("PlaywrightBrowserSession: frame {} unreadable: {}", frame.url(), e.getMessage());
            }
        }
        return out;
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public String title() {
        return page.title();
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("PlaywrightBrowserSession: close failed: {}", e.getMessage());
        } finally {
            playwright.close();
        }
    }
}
