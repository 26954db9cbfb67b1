package com.mike.leadscout.quality;

import com.mike.leadscout.util.Domains;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-field checks. Flags accumulate; the score is the lowest penalty any flag imposed.
 */
public final class FieldValidator {

    private static final Pattern EMAIL_FORMAT = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern HOST_FORMAT = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?(\\.[a-z0-9]([a-z0-9-]*[a-z0-9])?)*\\.[a-z]{2,}$");

    private static final Set<String> TEST_NUMBERS = Set.of(
            "1234567890", "0123456789", "9876543210", "5555555555", "1231231234"
    );

    private static final List<String> PARKED_INDICATORS = List.of(
            "parked", "forsale", "for-sale", "godaddy.com/domainfind", "sedoparking", "hugedomains",
            "buydomains", "domainmarket", "afternic"
    );

    private static final Set<String> PLACEHOLDER_DOMAINS = Set.of(
            "example.com", "example.org", "example.net", "test.com", "domain.com", "yoursite.com",
            "yourdomain.com", "website.com", "localhost"
    );

    public static final Set<String> SOCIAL_DOMAINS = Set.of(
            "facebook.com", "instagram.com", "linkedin.com", "twitter.com", "x.com", "tiktok.com",
            "youtube.com", "yelp.com", "pinterest.com"
    );

    public static final Set<String> GENERIC_LOCAL_PARTS = Set.of(
            "info", "contact", "hello", "support", "sales", "admin", "office", "team", "help"
    );

    public static final Set<String> PERSONAL_EMAIL_DOMAINS = Set.of(
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "aol.com", "icloud.com"
    );

    private static final Set<String> NOREPLY_LOCAL_PARTS = Set.of("noreply", "no-reply", "donotreply", "do-not-reply");

    private FieldValidator() {
    }

    public static FieldCheck validatePhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return FieldCheck.of(false, 0.0, QualityFlags.MISSING_PHONE);
        }
        String digits = BusinessNormalizer.normalizePhone(phone);
        if (digits == null) {
            return FieldCheck.of(false, 0.1, QualityFlags.INVALID_PHONE_FORMAT);
        }

        Accumulator acc = new Accumulator();
        if (digits.substring(3, 6).equals("555")) {
            acc.flag(QualityFlags.FAKE_555_PREFIX, 0.2, false);
        }
        if (TEST_NUMBERS.contains(digits)) {
            acc.flag(QualityFlags.TEST_NUMBER, 0.1, false);
        }
        if (digits.chars().distinct().count() <= 2) {
            acc.flag(QualityFlags.REPEATED_DIGITS, 0.1, false);
        }
        char areaStart = digits.charAt(0);
        if (areaStart == '0' || areaStart == '1') {
            acc.flag(QualityFlags.INVALID_AREA_CODE, 0.3, false);
        }
        return acc.result();
    }

    public static FieldCheck validateWebsite(String website) {
        if (website == null || website.isBlank()) {
            return FieldCheck.of(false, 0.0, QualityFlags.MISSING_WEBSITE);
        }
        String normalized = BusinessNormalizer.normalizeWebsite(website);
        String host = Domains.extractDomain(website);
        if (normalized == null || host == null || !HOST_FORMAT.matcher(host).matches()) {
            return FieldCheck.of(false, 0.1, QualityFlags.INVALID_URL);
        }

        Accumulator acc = new Accumulator();
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (PARKED_INDICATORS.stream().anyMatch(lower::contains)) {
            acc.flag(QualityFlags.PARKED_DOMAIN, 0.3, false);
        }
        if (PLACEHOLDER_DOMAINS.contains(host)) {
            acc.flag(QualityFlags.PLACEHOLDER_DOMAIN, 0.1, false);
        }
        if (isSocialHost(host)) {
            acc.flag(QualityFlags.SOCIAL_MEDIA_PROFILE, 0.7, true);
        }
        return acc.result();
    }

    public static FieldCheck validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return FieldCheck.of(false, 0.0, QualityFlags.MISSING_EMAIL);
        }
        String e = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL_FORMAT.matcher(e).matches()) {
            return FieldCheck.of(false, 0.1, QualityFlags.INVALID_EMAIL_FORMAT);
        }

        String local = e.substring(0, e.lastIndexOf('@'));
        String domain = e.substring(e.lastIndexOf('@') + 1);

        Accumulator acc = new Accumulator();
        if (GENERIC_LOCAL_PARTS.contains(local)) {
            acc.flag(QualityFlags.GENERIC_EMAIL, 0.7, true);
        }
        if (PERSONAL_EMAIL_DOMAINS.contains(domain)) {
            acc.flag(QualityFlags.PERSONAL_EMAIL_DOMAIN, 0.8, true);
        }
        if (NOREPLY_LOCAL_PARTS.contains(local)) {
            acc.flag(QualityFlags.NOREPLY_EMAIL, 0.2, false);
        }
        return acc.result();
    }

    public static FieldCheck validateName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            return FieldCheck.of(false, 0.0, QualityFlags.MISSING_NAME);
        }
        if (trimmed.length() < 3) {
            return FieldCheck.of(false, 0.0, QualityFlags.INVALID_NAME);
        }
        if (trimmed.length() < 5) {
            return FieldCheck.of(true, 0.7, QualityFlags.SHORT_NAME);
        }
        return FieldCheck.ok();
    }

    public static FieldCheck validateAddress(String address) {
        if (address == null || address.isBlank()) {
            return FieldCheck.of(false, 0.0, QualityFlags.MISSING_ADDRESS);
        }
        AddressParts parts = BusinessNormalizer.parseAddress(address);
        double score = 0.0;
        if (parts.zip() != null) score += 0.4;
        if (parts.state() != null) score += 0.2;
        if (parts.city() != null) score += 0.2;
        if (parts.street() != null) score += 0.2;
        score = Math.min(1.0, score);

        if (score < 1.0) {
            return new FieldCheck(score >= 0.4, score, List.of(QualityFlags.INCOMPLETE_ADDRESS));
        }
        return new FieldCheck(true, score, List.of());
    }

    public static boolean isSocialHost(String host) {
        if (host == null) return false;
        return SOCIAL_DOMAINS.stream().anyMatch(d -> host.equals(d) || host.endsWith("." + d));
    }

    private static final class Accumulator {
        private final List<String> flags = new ArrayList<>();
        private double score = 1.0;
        private boolean valid = true;

        void flag(String flag, double penaltyScore, boolean stillValid) {
            flags.add(flag);
            score = Math.min(score, penaltyScore);
            valid = valid && stillValid;
        }

        FieldCheck result() {
            return new FieldCheck(valid, score, List.copyOf(flags));
        }
    }
}
