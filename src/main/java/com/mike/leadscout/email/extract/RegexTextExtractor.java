package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

@Component
public class RegexTextExtractor implements EmailSourceExtractor {

    static final Pattern EMAIL_PATTERN =
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    @Override
    public String name() {
        return "markup";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        return scan(page.html());
    }

    public static Stream<String> scan(String text) {
        if (text == null || text.isBlank()) return Stream.empty();

        Matcher matcher = EMAIL_PATTERN.matcher(text);

        Stream.Builder<String> builder = Stream.builder();
        while (matcher.find()) {
            builder.add(matcher.group());
        }
        return builder.build();
    }
}
