package com.mike.leadscout.email.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.leadscout.browser.PageSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * JSON-LD {@code email} fields (LocalBusiness, Organization, Person, ...) and microdata {@code itemprop="email"}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructuredDataExtractor implements EmailSourceExtractor {

    private static final int MAX_DEPTH = 12;

    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "structured-data";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        Stream.Builder<String> builder = Stream.builder();

        for (Element script : page.document().select("script[type=application/ld+json]")) {
            String json = script.data();
            if (json == null || json.isBlank()) continue;
            try {
                collectEmails(objectMapper.readTree(json), builder, 0);
            } catch (JsonProcessingException e) {
                log.debug("StructuredDataExtractor: invalid JSON-LD on {}: {}", page.url(), e.getOriginalMessage());
            }
        }

        for (Element el : page.document().select("[itemprop=email]")) {
            String value = el.hasAttr("content") ? el.attr("content") : el.hasAttr("href") ? el.attr("href") : el.text();
            if (value.regionMatches(true, 0, "mailto:", 0, 7)) value = value.substring(7);
            if (!value.isBlank()) builder.add(value.trim());
        }
        return builder.build();
    }

    private static void collectEmails(JsonNode node, Stream.Builder<String> builder, int depth) {
        if (node == null || depth > MAX_DEPTH) return;

        if (node.isArray()) {
            for (JsonNode child : node) {
                collectEmails(child, builder, depth + 1);
            }
            return;
        }
        if (!node.isObject()) return;

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if ("email".equalsIgnoreCase(field.getKey()) && value.isTextual()) {
                String email = value.asText();
                if (email.regionMatches(true, 0, "mailto:", 0, 7)) email = email.substring(7);
                builder.add(email.trim());
            } else if (value.isContainerNode()) {
                collectEmails(value, builder, depth + 1);
            }
        }
    }
}
