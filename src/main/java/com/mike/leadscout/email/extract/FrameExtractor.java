package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Embedded frames (contact widgets, map cards) scanned for raw and mailto addresses.
 */
@Component
@RequiredArgsConstructor
public class FrameExtractor implements EmailSourceExtractor {

    private final MailToExtractor mailToExtractor;

    @Override
    public String name() {
        return "frames";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        return page.frameHtml().stream()
                .flatMap(html -> Stream.concat(RegexTextExtractor.scan(html), mailToExtractor.scan(html)));
    }
}
