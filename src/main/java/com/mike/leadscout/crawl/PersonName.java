package com.mike.leadscout.crawl;

public record PersonName(String first, String last) {
}
