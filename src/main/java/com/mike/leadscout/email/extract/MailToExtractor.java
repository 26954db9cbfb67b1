package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Addresses behind mailto: links. Anchors are read from the parsed page, then the raw markup is
 * scanned for links built by inline scripts and onclick handlers.
 */
@Component
@RequiredArgsConstructor
public class MailToExtractor implements EmailSourceExtractor {

    private static final Pattern MAILTO = Pattern.compile("(?i)mailto:([^\"'\\s>?]+)");

    private final TextObfuscationNormalizer obfuscationNormalizer;

    @Override
    public String name() {
        return "mailto";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        List<String> out = new ArrayList<>();
        for (Element a : page.document().select("a[href^=mailto:]")) {
            collect(a.attr("href"), out);
        }
        collect(page.html(), out);
        return out.stream().distinct();
    }

    Stream<String> scan(String html) {
        List<String> out = new ArrayList<>();
        collect(html, out);
        return out.stream();
    }

    private void collect(String markup, List<String> out) {
        if (markup == null || markup.isBlank()) return;
        Matcher m = MAILTO.matcher(markup);
        while (m.find()) {
            String address = obfuscationNormalizer.normalize(m.group(1)).trim();
            if (!address.isEmpty()) out.add(address);
        }
    }
}
