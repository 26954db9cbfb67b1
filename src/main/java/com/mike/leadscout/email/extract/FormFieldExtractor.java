package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

@Component
public class FormFieldExtractor implements EmailSourceExtractor {

    @Override
    public String name() {
        return "form-fields";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        Document doc = page.document();
        Stream.Builder<String> builder = Stream.builder();

        for (Element form : doc.select("form[action]")) {
            String action = form.attr("action");
            if (action.regionMatches(true, 0, "mailto:", 0, 7)) {
                String raw = action.substring(7);
                int q = raw.indexOf('?');
                builder.add(q >= 0 ? raw.substring(0, q) : raw);
            }
        }
        for (Element input : doc.select("input[type=hidden][value*=@], input[type=email][value]")) {
            String value = input.attr("value").trim();
            if (value.contains("@")) builder.add(value);
        }
        return builder.build();
    }
}
