package com.mike.leadscout.crawl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SitemapParserTest {

    @Test
    @DisplayName("contact-like decided by path, not host")
    void contact_like_by_path() {
        assertTrue(SitemapParser.isContactLike("https://acme.com/our-office-locations"));
        assertTrue(SitemapParser.isContactLike("https://acme.com/about/"));
        assertFalse(SitemapParser.isContactLike("https://contact-acme.com/pricing"));
        assertFalse(SitemapParser.isContactLike("https://acme.com/has space"));
    }

    @Test
    @DisplayName("url entries filtered to contact-like pages")
    void contact_urls() {
        //Arrange
        Document doc = Jsoup.parse("<?xml version=\"1.0\"?><urlset>"
                + "<url><loc>https://acme.com/</loc></url>"
                + "<url><loc> https://acme.com/contact-us </loc></url>"
                + "<url><loc>https://acme.com/blog/post-1</loc></url>"
                + "<url><loc>https://acme.com/team</loc></url>"
                + "</urlset>", "", Parser.xmlParser());
        //Act
        List<String> urls = SitemapParser.contactUrls(doc);
        //Assert
        assertEquals(List.of("https://acme.com/contact-us", "https://acme.com/team"), urls);
    }

    @Test
    @DisplayName("sitemap index lists child sitemaps")
    void child_sitemaps() {
        //Arrange
        Document doc = Jsoup.parse("<sitemapindex>"
                + "<sitemap><loc>https://acme.com/page-sitemap.xml</loc></sitemap>"
                + "<sitemap><loc></loc></sitemap>"
                + "</sitemapindex>", "", Parser.xmlParser());
        //Act
        List<String> children = SitemapParser.childSitemaps(doc);
        //Assert
        assertEquals(List.of("https://acme.com/page-sitemap.xml"), children);
    }
}
