package com.mike.leadscout.email.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans raw candidates scraped from markup before they are validated.
 */
@Component
@Slf4j
public class EmailNormalizer {

    /**
     * Stripped repeatedly until none applies: scheme, escaped newlines and JSON-escaped angle brackets,
     * quote and bracket debris, leftover percent escapes.
     */
    private static final List<Pattern> LEADING_NOISE = List.of(
            Pattern.compile("^mailto:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(?:\\\\[nrt]|u003[ce])+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^[\"'<>()\\[\\];:,\\s]+"),
            Pattern.compile("^(?:%[0-9A-Fa-f]{2})+")
    );

    private static final Pattern TRAILING_NOISE = Pattern.compile("[)\\]}.,;:'\"<>\\s]+$");

    private static final Pattern GLUED_PHONE_DIGITS = Pattern.compile("^\\d{3,}(?=[a-z])");

    public String normalizeRawCandidate(String raw) {
        if (raw == null) return null;

        String email = decode(raw).trim();
        String previous;
        do {
            previous = email;
            for (Pattern noise : LEADING_NOISE) {
                email = noise.matcher(email).replaceFirst("");
            }
        } while (!email.equals(previous));
        email = TRAILING_NOISE.matcher(email).replaceFirst("");

        if (email.isEmpty() || !Character.isLetterOrDigit(email.charAt(0))) return null;
        return email;
    }

    /**
     * Lower-cases and drops phone digits glued in front of the address ("5125550100info" -> "info").
     */
    public String normalizeLocalPart(String localPart) {
        if (localPart == null) return null;
        String lp = GLUED_PHONE_DIGITS.matcher(localPart.trim().toLowerCase(Locale.ROOT)).replaceFirst("");
        return lp.isBlank() ? null : lp;
    }

    private static String decode(String raw) {
        if (raw.indexOf('%') < 0) return raw;
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("EmailNormalizer: cannot URL-decode '{}', using it as is", raw);
            return raw;
        }
    }
}
