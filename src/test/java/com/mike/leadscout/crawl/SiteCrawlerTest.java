package com.mike.leadscout.crawl;

import com.mike.leadscout.browser.BrowserSession;
import com.mike.leadscout.browser.PageSnapshot;
import com.mike.leadscout.config.CascadeProperties;
import com.mike.leadscout.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiteCrawlerTest {

    private static final String HOME = "https://smithdental.com";

    private CascadeProperties cascade;
    private SiteCrawler crawler;
    private FakeSession session;

    @BeforeEach
    void setUp() {
        cascade = new CascadeProperties();
        crawler = new SiteCrawler(TestProperties.harvester(), cascade);
        session = new FakeSession();
    }

    @Nested
    @DisplayName("crawlContactPaths")
    class CrawlContactPaths {

        @Test
        @DisplayName("follows the homepage contact link and stops after two generic inboxes")
        void stops_on_two_generic() {
            //Arrange
            session.page(HOME, "<a href=\"https://www.facebook.com/sharer/sharer.php?u=x\">share</a>"
                    + "<a href=\"https://www.facebook.com/smithdental\">fb</a>"
                    + "<a href=\"/services\">Services</a><a href=\"/contact-us\">Contact</a>"
                    + "<footer><a href=\"mailto:info@smithdental.com\">Email us</a></footer>");
            session.page(HOME + "/contact-us", "<p>Write to office@smithdental.com</p>");
            CrawlState state = new CrawlState("smithdental.com");

            //Act
            crawler.crawlContactPaths(session, HOME, state);

            //Assert
            assertEquals(List.of(HOME, HOME + "/contact-us"), session.navigated);
            assertEquals(2, state.topPriorityCount());
            assertEquals("info@smithdental.com", state.best().email());
            assertEquals(Map.of("facebook", "https://www.facebook.com/smithdental"), state.socialLinks());
        }

        @Test
        @DisplayName("well-known paths are bounded by maxContactPaths")
        void bounded_paths() {
            //Arrange
            cascade.getCrawl().setMaxContactPaths(5);
            CrawlState state = new CrawlState("smithdental.com");

            //Act
            crawler.crawlContactPaths(session, HOME, state);

            //Assert
            assertEquals(6, session.navigated.size());
            assertEquals(HOME + "/contact", session.navigated.get(1));
            assertTrue(state.isEmpty());
        }

        @Test
        @DisplayName("linked vCard is read as text and credited to its URL")
        void reads_documents() {
            //Arrange
            cascade.getCrawl().setMaxContactPaths(1);
            session.page(HOME, "<a href=\"/files/frontdesk.vcf\">vCard</a>");
            session.page(HOME + "/files/frontdesk.vcf", "BEGIN:VCARD\nEMAIL;TYPE=work:frontdesk@smithdental.com\nEND:VCARD");
            CrawlState state = new CrawlState("smithdental.com");

            //Act
            crawler.crawlContactPaths(session, HOME, state);

            //Assert
            CrawlFinding finding = state.best();
            assertEquals("frontdesk@smithdental.com", finding.email());
            assertEquals(HOME + "/files/frontdesk.vcf", finding.pageUrl());
            assertTrue(finding.onDomain());
        }
    }

    @Test
    @DisplayName("crawlSite visits contact-like links first and stops at the first generic inbox")
    void broad_crawl() {
        //Arrange
        session.page(HOME, "<a href=\"/services\">Services</a><a href=\"/about\">About</a>");
        session.page(HOME + "/about", "<p>contact@smithdental.com</p>");
        session.page(HOME + "/services", "<p>Cleanings</p>");
        CrawlState state = new CrawlState("smithdental.com");

        //Act
        crawler.crawlSite(session, HOME, state);

        //Assert
        assertEquals(List.of(HOME, HOME + "/about"), session.navigated);
        assertTrue(state.hasTopPriority());
    }

    @Test
    @DisplayName("visitAll skips pages already visited")
    void visit_all_skips_visited() {
        //Arrange
        session.page(HOME + "/team", "<p>Dr. Jane Smith</p>");
        CrawlState state = new CrawlState("smithdental.com");
        state.markVisited("http://www.smithdental.com/team/");

        //Act
        crawler.visitAll(session, List.of(HOME + "/team"), state);

        //Assert
        assertTrue(session.navigated.isEmpty());
    }

    @Nested
    @DisplayName("link helpers")
    class Helpers {

        @Test
        @DisplayName("contact-like by href or by anchor text")
        void looks_like_contact() {
            assertTrue(SiteCrawler.looksLikeContact("/contact-us", ""));
            assertTrue(SiteCrawler.looksLikeContact("/p?id=7", "Meet our Team"));
            assertFalse(SiteCrawler.looksLikeContact("/services", "Services"));
            assertFalse(SiteCrawler.looksLikeContact(null, null));
        }

        @Test
        @DisplayName("paths resolve against a base without trailing slash")
        void resolve() {
            assertEquals(HOME + "/contact", SiteCrawler.resolve(HOME, "/contact"));
            assertEquals(HOME + "/about-us", SiteCrawler.resolve(HOME + "/", "about-us"));
        }

        @Test
        @DisplayName("contact links stay on site, skip mailto and lose their fragment")
        void contact_links() {
            //Arrange
            PageSnapshot page = PageSnapshot.ofHtml(HOME,
                    "<a href=\"/contact#form\">Contact</a><a href=\"https://other.com/contact\">Partner</a>"
                            + "<a href=\"mailto:info@smithdental.com\">Email us</a><a href=\"/pricing\">Pricing</a>");
            //Act
            List<String> links = SiteCrawler.contactLinks(page, HOME);
            //Assert
            assertEquals(List.of(HOME + "/contact"), links);
        }
    }

    /**
     * Serves canned pages; unknown URLs answer with an error status.
     */
    static class FakeSession implements BrowserSession {

        private final Map<String, String> pages = new HashMap<>();
        final List<String> navigated = new ArrayList<>();
        private String current;

        void page(String url, String html) {
            pages.put(url, html);
        }

        @Override
        public boolean navigate(String url, Duration timeout) {
            navigated.add(url);
            current = url;
            return pages.containsKey(url);
        }

        @Override
        public Object evaluate(String script) {
            return null;
        }

        @Override
        public String content() {
            return pages.getOrDefault(current, "");
        }

        @Override
        public String renderedText() {
            return "";
        }

        @Override
        public List<String> frames() {
            return List.of();
        }

        @Override
        public String currentUrl() {
            return current;
        }

        @Override
        public String title() {
            return "";
        }

        @Override
        public void close() {
        }
    }
}
