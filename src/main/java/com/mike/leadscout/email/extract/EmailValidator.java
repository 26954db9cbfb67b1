package com.mike.leadscout.email.extract;

import com.mike.leadscout.config.EmailProperties;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class EmailValidator {

    private static final Pattern LOCAL_PART_PATTERN =
            Pattern.compile("^[a-z0-9._%+-]{1,64}$");

    private static final Pattern SUSPICIOUS_UNICODE_ESCAPE =
            Pattern.compile("u00[0-9a-fA-F]{2}");

    private static final Pattern HOST_PATTERN = Pattern.compile("^[a-zA-Z0-9.-]+$");

    private static final Pattern PLAIN_TLD = Pattern.compile("^[a-z]{2,24}$");

    /**
     * Longest first, so "com" wins over "co" when repairing "comcontact".
     */
    private final List<String> knownTlds;

    public EmailValidator(EmailProperties props) {
        this.knownTlds = props.knownTlds() == null ? List.of() : props.knownTlds().stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    public boolean isLocalPartAllowed(String localPart) {
        if (localPart == null) return false;
        String lp = localPart.trim().toLowerCase(Locale.ROOT);
        if (SUSPICIOUS_UNICODE_ESCAPE.matcher(lp).find()) return false;
        if (lp.startsWith(".") || lp.endsWith(".") || lp.contains("..")) return false;
        return LOCAL_PART_PATTERN.matcher(lp).matches();
    }

    public boolean isHostWithoutTldAllowed(String hostWithoutTldRaw) {
        if (hostWithoutTldRaw == null) return false;

        String h = hostWithoutTldRaw.trim();
        if (h.isBlank()) return false;
        if (!HOST_PATTERN.matcher(h).matches()) return false;
        if (h.startsWith(".") || h.endsWith(".")) return false;
        if (h.startsWith("-") || h.endsWith("-")) return false;
        if (h.contains("..")) return false;

        return true;
    }

    /**
     * Known TLD the raw tail starts with, or the tail itself when no list is configured.
     */
    public String extractKnownTld(String tldPart) {
        if (tldPart == null || tldPart.isEmpty()) return null;

        String lower = tldPart.toLowerCase(Locale.ROOT);

        if (knownTlds.isEmpty()) {
            return PLAIN_TLD.matcher(lower).matches() ? lower : null;
        }
        for (String allowed : knownTlds) {
            if (lower.equals(allowed) || lower.startsWith(allowed)) {
                return allowed;
            }
        }
        return null;
    }
}
