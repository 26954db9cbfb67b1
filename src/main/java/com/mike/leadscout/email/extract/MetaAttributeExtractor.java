package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Addresses hidden in attributes: meta tags, {@code data-email}, or split {@code data-user}/{@code data-domain} pairs.
 */
@Component
public class MetaAttributeExtractor implements EmailSourceExtractor {

    @Override
    public String name() {
        return "meta-attributes";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        Document doc = page.document();
        Stream.Builder<String> builder = Stream.builder();

        for (Element meta : doc.select("meta[content*=@]")) {
            RegexTextExtractor.scan(meta.attr("content")).forEach(builder::add);
        }
        for (Element el : doc.select("[data-email]")) {
            String value = el.attr("data-email").trim();
            if (value.contains("@")) builder.add(value);
        }
        for (Element el : doc.select("[data-user][data-domain]")) {
            String user = el.attr("data-user").trim();
            String domain = el.attr("data-domain").trim();
            if (!user.isEmpty() && !domain.isEmpty()) builder.add(user + "@" + domain);
        }
        return builder.build();
    }
}
