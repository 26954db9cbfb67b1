package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every extractor over a page, canonicalizes and filters the union, and orders the result
 * by priority (generic inbox first), then by first appearance.
 */
@Component
@Slf4j
public class EmailHarvester {

    private final List<EmailSourceExtractor> extractors;
    private final EmailCanonicalizer canonicalizer;
    private final TextObfuscationNormalizer obfuscationNormalizer;

    public EmailHarvester(List<EmailSourceExtractor> extractors,
                          EmailCanonicalizer canonicalizer,
                          TextObfuscationNormalizer obfuscationNormalizer) {
        this.extractors = List.copyOf(extractors);
        this.canonicalizer = canonicalizer;
        this.obfuscationNormalizer = obfuscationNormalizer;
    }

    public List<HarvestedEmail> harvest(PageSnapshot page) {
        Map<String, HarvestedEmail> found = new LinkedHashMap<>();
        for (EmailSourceExtractor extractor : extractors) {
            try {
                extractor.extractCandidates(page).forEach(raw -> add(found, raw, extractor.name()));
            } catch (RuntimeException e) {
                log.warn("EmailHarvester: extractor {} failed on {}: {}", extractor.name(), page.url(), e.getMessage());
            }
        }
        List<HarvestedEmail> out = sorted(found);
        if (!out.isEmpty()) {
            log.debug("EmailHarvester: {} -> {}", page.url(), out);
        }
        return out;
    }

    /**
     * Free text such as search snippets or registry records.
     */
    public List<HarvestedEmail> harvestText(String text) {
        Map<String, HarvestedEmail> found = new LinkedHashMap<>();
        RegexTextExtractor.scan(obfuscationNormalizer.normalize(text)).forEach(raw -> add(found, raw, "text"));
        return sorted(found);
    }

    public String canonicalize(String raw) {
        String email = canonicalizer.canonicalize(raw);
        return EmailFilter.isAcceptable(email) ? email : null;
    }

    private void add(Map<String, HarvestedEmail> found, String raw, String extractor) {
        String email = canonicalize(raw);
        if (email == null || found.containsKey(email)) return;
        found.put(email, new HarvestedEmail(email, EmailPriority.of(email), extractor));
    }

    private static List<HarvestedEmail> sorted(Map<String, HarvestedEmail> found) {
        List<HarvestedEmail> out = new ArrayList<>(found.values());
        out.sort(Comparator.comparingInt(HarvestedEmail::priority));
        return out;
    }
}
