package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

@Component
public class CloudflareCfEmailExtractor implements EmailSourceExtractor {

    private static final Pattern CLOUDFLARE_PATTERN =
            Pattern.compile("data-cfemail=\"([0-9a-fA-F]+)\"");

    private static final Pattern CLOUDFLARE_HREF_PATTERN =
            Pattern.compile("/cdn-cgi/l/email-protection#([0-9a-fA-F]+)");

    @Override
    public String name() {
        return "cloudflare";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        String html = page.html();
        if (html == null || html.isBlank()) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();
        decodeAll(CLOUDFLARE_PATTERN.matcher(html), builder);
        decodeAll(CLOUDFLARE_HREF_PATTERN.matcher(html), builder);
        return builder.build();
    }

    private static void decodeAll(Matcher matcher, Stream.Builder<String> builder) {
        while (matcher.find()) {
            String decoded = CloudflareEmailDecoder.decode(matcher.group(1));
            if (decoded != null && !decoded.isBlank()) builder.add(decoded);
        }
    }
}
