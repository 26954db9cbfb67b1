package com.mike.leadscout.browser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * What a browser saw on one page: final URL, markup, visible text and the markup of embedded frames.
 * The parsed document is built once, on first use.
 */
public final class PageSnapshot {

    private final String url;
    private final String html;
    private final String text;
    private final List<String> frameHtml;
    private Document document;

    public PageSnapshot(String url, String html, String text, List<String> frameHtml) {
        this.url = url;
        this.html = html == null ? "" : html;
        this.text = text == null ? "" : text;
        this.frameHtml = frameHtml == null ? List.of() : List.copyOf(frameHtml);
    }

    public static PageSnapshot ofHtml(String url, String html) {
        return new PageSnapshot(url, html, null, List.of());
    }

    public String url() {
        return url;
    }

    public String html() {
        return html;
    }

    /**
     * Visible text; falls back to the text of the parsed markup when the backend could not render.
     */
    public String text() {
        if (!text.isBlank()) return text;
        Document doc = document();
        return doc.body() == null ? "" : doc.body().text();
    }

    public List<String> frameHtml() {
        return frameHtml;
    }

    public synchronized Document document() {
        if (document == null) {
            document = url == null ? Jsoup.parse(html) : Jsoup.parse(html, url);
        }
        return document;
    }
}
