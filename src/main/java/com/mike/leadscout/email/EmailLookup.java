package com.mike.leadscout.email;

import com.mike.leadscout.browser.BrowserSession;
import com.mike.leadscout.browser.BrowserSessionFactory;
import com.mike.leadscout.crawl.CrawlState;
import com.mike.leadscout.quality.BusinessNormalizer;
import com.mike.leadscout.quality.CanonicalBusiness;
import com.mike.leadscout.quality.FieldValidator;
import com.mike.leadscout.quality.QualityFlags;
import com.mike.leadscout.resilience.CancellationToken;
import com.mike.leadscout.util.Domains;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-business context of one cascade run: the target, its domain, the shared browser session
 * and what earlier phases have already crawled. Confined to the worker running the cascade.
 */
@Slf4j
public class EmailLookup implements AutoCloseable {

    @Getter
    private final CanonicalBusiness business;
    @Getter
    private final String website;
    @Getter
    private final String domain;
    @Getter
    private final String baseUrl;
    @Getter
    private final boolean parkedDomain;
    @Getter
    private final boolean discoveredWebsite;
    @Getter
    private final CancellationToken token;
    @Getter
    private final CrawlState crawlState;

    private final BrowserSessionFactory sessionFactory;
    private BrowserSession session;
    private final Map<String, Boolean> catchAllByMailDomain = new HashMap<>();

    public EmailLookup(CanonicalBusiness business,
                       String website,
                       boolean discoveredWebsite,
                       BrowserSessionFactory sessionFactory,
                       CancellationToken token) {
        this.business = business;
        this.website = website;
        this.discoveredWebsite = discoveredWebsite;
        this.domain = Domains.extractDomain(website);
        this.baseUrl = Domains.toBaseUrl(website);
        this.sessionFactory = sessionFactory;
        this.token = token == null ? CancellationToken.none() : token;
        this.crawlState = new CrawlState(domain);
        this.parkedDomain = isParked(business, website);
    }

    public boolean hasDomain() {
        return domain != null && baseUrl != null && !FieldValidator.isSocialHost(domain);
    }

    public String businessName() {
        return business.getName();
    }

    /**
     * Two-letter state of the business address, or null.
     */
    public String state() {
        return BusinessNormalizer.parseAddress(business.getAddress()).state();
    }

    /**
     * Opens the browser session on first use.
     */
    public BrowserSession session() {
        if (session == null) {
            session = sessionFactory.open();
        }
        return session;
    }

    /**
     * Catch-all verdict already probed for a mail domain during this run, or null.
     */
    public Boolean catchAll(String mailDomain) {
        return mailDomain == null ? null : catchAllByMailDomain.get(mailDomain);
    }

    public void rememberCatchAll(String mailDomain, boolean value) {
        if (mailDomain != null) catchAllByMailDomain.put(mailDomain, value);
    }

    @Override
    public void close() {
        if (session == null) return;
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("EmailLookup: failed to close browser session for {}: {}", domain, e.getMessage());
        }
        session = null;
    }

    private static boolean isParked(CanonicalBusiness business, String website) {
        if (business.getQuality() != null && business.getQuality().hasFlag(QualityFlags.PARKED_DOMAIN)) return true;
        return website != null && FieldValidator.validateWebsite(website).hasFlag(QualityFlags.PARKED_DOMAIN);
    }
}
