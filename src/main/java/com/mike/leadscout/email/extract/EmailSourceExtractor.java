package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;

import java.util.stream.Stream;

/**
 * One independent way of spotting email addresses on a page. Results are raw: the harvester
 * canonicalizes, filters and dedupes the union of all extractors.
 */
public interface EmailSourceExtractor {

    String name();

    Stream<String> extractCandidates(PageSnapshot page);
}
