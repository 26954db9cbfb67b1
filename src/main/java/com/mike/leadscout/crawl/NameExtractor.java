package com.mike.leadscout.crawl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.leadscout.browser.PageSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds owner and staff names in page text ("Owner: Jane Smith", "Jane Smith, DDS")
 * and in JSON-LD Person objects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NameExtractor {

    static final int MAX_NAMES = 5;

    private static final String NAME = "([A-Z][a-z]+)\\s+([A-Z][a-z]+)";

    private static final List<Pattern> TEXT_PATTERNS = List.of(
            Pattern.compile("(?i:owner|founder|ceo|president|director|manager|dr\\.?|doctor)[\\s:]+" + NAME),
            Pattern.compile("(?i:meet|about)\\s+" + NAME),
            Pattern.compile(NAME + "[\\s,]+(?:DDS|DMD|MD|DO|DC|PT|OD|DPM|(?i:owner|founder))")
    );

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "our", "your", "this", "that", "meet", "about", "contact", "us", "team", "home"
    );

    private final ObjectMapper objectMapper;

    public List<PersonName> extract(List<PageSnapshot> pages) {
        Set<PersonName> names = new LinkedHashSet<>();
        for (PageSnapshot page : pages) {
            names.addAll(fromText(page.text()));
            names.addAll(fromStructuredData(page));
            if (names.size() >= MAX_NAMES) break;
        }
        List<PersonName> out = new ArrayList<>(names);
        return out.size() > MAX_NAMES ? List.copyOf(out.subList(0, MAX_NAMES)) : List.copyOf(out);
    }

    static List<PersonName> fromText(String text) {
        List<PersonName> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        for (Pattern p : TEXT_PATTERNS) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                PersonName name = toName(m.group(1), m.group(2));
                if (name != null && !out.contains(name)) out.add(name);
            }
        }
        return out;
    }

    List<PersonName> fromStructuredData(PageSnapshot page) {
        List<PersonName> out = new ArrayList<>();
        for (Element script : page.document().select("script[type=application/ld+json]")) {
            try {
                collectPersons(objectMapper.readTree(script.data()), out);
            } catch (JsonProcessingException e) {
                log.debug("NameExtractor: unreadable JSON-LD on {}: {}", page.url(), e.getOriginalMessage());
            }
        }
        return out;
    }

    private static void collectPersons(JsonNode node, List<PersonName> out) {
        if (node == null) return;
        if (node.isArray()) {
            node.forEach(n -> collectPersons(n, out));
            return;
        }
        if (!node.isObject()) return;

        if (node.path("@type").asText("").contains("Person") && node.path("name").isTextual()) {
            String[] parts = node.path("name").asText().trim().split("\\s+");
            if (parts.length >= 2) {
                PersonName name = toName(parts[0], parts[parts.length - 1]);
                if (name != null && !out.contains(name)) out.add(name);
            }
        }
        node.elements().forEachRemaining(child -> collectPersons(child, out));
    }

    private static PersonName toName(String first, String last) {
        if (first == null || last == null || first.length() < 2 || last.length() < 2) return null;
        if (STOP_WORDS.contains(first.toLowerCase(Locale.ROOT)) || STOP_WORDS.contains(last.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return new PersonName(first, last);
    }
}
