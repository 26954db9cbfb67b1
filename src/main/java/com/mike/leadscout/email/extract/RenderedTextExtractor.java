package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Visible text after at/dot de-obfuscation. Catches addresses assembled by scripts or spelled out.
 */
@Component
@RequiredArgsConstructor
public class RenderedTextExtractor implements EmailSourceExtractor {

    private final TextObfuscationNormalizer obfuscationNormalizer;

    @Override
    public String name() {
        return "rendered-text";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        return RegexTextExtractor.scan(obfuscationNormalizer.normalize(page.text()));
    }
}
