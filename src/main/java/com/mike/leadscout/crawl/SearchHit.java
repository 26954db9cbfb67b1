package com.mike.leadscout.crawl;

public record SearchHit(
        String title,
        String link,
        String snippet
) {
    public String text() {
        return (title == null ? "" : title) + " " + (snippet == null ? "" : snippet);
    }
}
