package com.mike.leadscout.crawl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SocialPlatformTest {

    @Test
    @DisplayName("platform recognised from profile URL, subdomains included")
    void of_url() {
        assertEquals(SocialPlatform.FACEBOOK, SocialPlatform.of("https://m.facebook.com/smithdental"));
        assertEquals(SocialPlatform.INSTAGRAM, SocialPlatform.of("instagram.com/smithdental"));
        assertEquals(SocialPlatform.LINKEDIN, SocialPlatform.of("https://www.linkedin.com/company/acme"));
        assertNull(SocialPlatform.of("https://twitter.com/acme"));
    }

    @Test
    @DisplayName("share buttons and tracking pixels are not profiles")
    void share_links_rejected() {
        assertTrue(SocialPlatform.isProfileLink("https://www.facebook.com/smithdental"));
        assertFalse(SocialPlatform.isProfileLink("https://www.facebook.com/sharer/sharer.php?u=x"));
        assertFalse(SocialPlatform.isProfileLink("https://www.linkedin.com/shareArticle?url=x"));
        assertFalse(SocialPlatform.isProfileLink("https://www.facebook.com/tr?id=123"));
        assertFalse(SocialPlatform.isProfileLink("https://www.facebook.com/plugins/page.php"));
        assertFalse(SocialPlatform.isProfileLink("https://smithdental.com"));
    }

    @Test
    @DisplayName("about URL drops query and trailing slash; instagram has no about page")
    void about_url() {
        assertEquals("https://www.facebook.com/smithdental/about",
                SocialPlatform.FACEBOOK.aboutUrl("https://www.facebook.com/smithdental/?ref=page"));
        assertEquals("https://www.linkedin.com/company/acme/about",
                SocialPlatform.LINKEDIN.aboutUrl("https://www.linkedin.com/company/acme/about/"));
        assertEquals("https://instagram.com/smithdental",
                SocialPlatform.INSTAGRAM.aboutUrl("https://instagram.com/smithdental/"));
    }

    @Test
    @DisplayName("key is the lower-case name")
    void key() {
        assertEquals("linkedin", SocialPlatform.LINKEDIN.key());
    }
}
