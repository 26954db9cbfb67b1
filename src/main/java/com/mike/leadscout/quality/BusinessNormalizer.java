package com.mike.leadscout.quality;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical forms used for matching. Every normalize method is idempotent.
 */
public final class BusinessNormalizer {

    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

    private static final Pattern ZIP = Pattern.compile("\\b(\\d{5})(-\\d{4})?\\b");
    private static final Pattern STATE = Pattern.compile("\\b([A-Z]{2})\\b(?=\\s*\\d{5}|\\s*$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATE_ZIP_TAIL = Pattern.compile("\\s*\\b[A-Za-z]{2}\\b\\s*(\\d{5}(-\\d{4})?)?\\s*$");

    private static final List<String> NAME_PREFIXES = List.of(
            "the", "a", "an", "sponsored", "ad", "advertisement", "featured"
    );

    private static final List<String> NAME_SUFFIXES = List.of(
            "inc", "incorporated", "corp", "corporation", "llc", "llp", "lp", "ltd", "limited",
            "co", "company", "pllc", "pc", "pa", "dba", "group", "holdings", "enterprises",
            "services", "solutions", "associates", "partners"
    );

    private static final Map<String, String> ADDRESS_WORDS = new LinkedHashMap<>();
    /**
     * Longest name first, so "west virginia" is replaced before "virginia".
     */
    static final Map<String, String> STATE_NAMES = new LinkedHashMap<>();

    static {
        ADDRESS_WORDS.put("street", "st");
        ADDRESS_WORDS.put("avenue", "ave");
        ADDRESS_WORDS.put("road", "rd");
        ADDRESS_WORDS.put("boulevard", "blvd");
        ADDRESS_WORDS.put("drive", "dr");
        ADDRESS_WORDS.put("lane", "ln");
        ADDRESS_WORDS.put("court", "ct");
        ADDRESS_WORDS.put("place", "pl");
        ADDRESS_WORDS.put("parkway", "pkwy");
        ADDRESS_WORDS.put("highway", "hwy");
        ADDRESS_WORDS.put("suite", "ste");
        ADDRESS_WORDS.put("apartment", "apt");
        ADDRESS_WORDS.put("building", "bldg");
        ADDRESS_WORDS.put("floor", "fl");
        ADDRESS_WORDS.put("north", "n");
        ADDRESS_WORDS.put("south", "s");
        ADDRESS_WORDS.put("east", "e");
        ADDRESS_WORDS.put("west", "w");

        String[][] states = {
                {"alabama", "al"}, {"alaska", "ak"}, {"arizona", "az"}, {"arkansas", "ar"}, {"california", "ca"},
                {"colorado", "co"}, {"connecticut", "ct"}, {"delaware", "de"}, {"florida", "fl"}, {"georgia", "ga"},
                {"hawaii", "hi"}, {"idaho", "id"}, {"illinois", "il"}, {"indiana", "in"}, {"iowa", "ia"},
                {"kansas", "ks"}, {"kentucky", "ky"}, {"louisiana", "la"}, {"maine", "me"}, {"maryland", "md"},
                {"massachusetts", "ma"}, {"michigan", "mi"}, {"minnesota", "mn"}, {"mississippi", "ms"},
                {"missouri", "mo"}, {"montana", "mt"}, {"nebraska", "ne"}, {"nevada", "nv"},
                {"new hampshire", "nh"}, {"new jersey", "nj"}, {"new mexico", "nm"}, {"new york", "ny"},
                {"north carolina", "nc"}, {"north dakota", "nd"}, {"ohio", "oh"}, {"oklahoma", "ok"},
                {"oregon", "or"}, {"pennsylvania", "pa"}, {"rhode island", "ri"}, {"south carolina", "sc"},
                {"south dakota", "sd"}, {"tennessee", "tn"}, {"texas", "tx"}, {"utah", "ut"}, {"vermont", "vt"},
                {"virginia", "va"}, {"washington", "wa"}, {"west virginia", "wv"}, {"wisconsin", "wi"},
                {"wyoming", "wy"}, {"district of columbia", "dc"}
        };
        Arrays.sort(states, Comparator.comparingInt((String[] s) -> s[0].length()).reversed());
        for (String[] s : states) {
            STATE_NAMES.put(s[0], s[1]);
        }
    }

    private BusinessNormalizer() {
    }

    /**
     * Lower-cased name without punctuation, noise prefixes ("Sponsored:", "The") or legal suffixes ("LLC").
     */
    public static String normalizeName(String name) {
        if (name == null) return null;

        String s = name.toLowerCase(Locale.ROOT);
        s = APOSTROPHES.matcher(s).replaceAll("");
        s = NON_WORD.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();

        boolean changed = true;
        while (changed) {
            changed = false;
            for (String prefix : NAME_PREFIXES) {
                if (s.startsWith(prefix + " ")) {
                    s = s.substring(prefix.length()).trim();
                    changed = true;
                }
            }
            for (String suffix : NAME_SUFFIXES) {
                if (s.endsWith(" " + suffix)) {
                    s = s.substring(0, s.length() - suffix.length()).trim();
                    changed = true;
                }
            }
        }
        return s;
    }

    /**
     * Ten-digit NANP number, or null when the input cannot be one.
     */
    public static String normalizePhone(String phone) {
        if (phone == null) return null;
        String digits = NON_DIGITS.matcher(phone).replaceAll("");
        if (digits.length() == 11 && digits.startsWith("1")) {
            digits = digits.substring(1);
        }
        return digits.length() == 10 ? digits : null;
    }

    /**
     * Host without "www." plus path without trailing slash, e.g. {@code example.com/dental}.
     * Percent-escapes in the path are kept as written.
     */
    public static String normalizeWebsite(String website) {
        if (website == null || website.isBlank()) return null;

        String s = website.trim();
        if (!SCHEME.matcher(s).find()) {
            s = "https://" + s;
        }

        String host;
        String path;
        try {
            URI uri = new URI(s);
            host = uri.getHost();
            path = uri.getRawPath();
        } catch (URISyntaxException e) {
            host = null;
            path = null;
        }

        if (host == null) {
            Matcher m = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://([^/?#:]+)([^?#]*)").matcher(s);
            if (!m.find()) return null;
            host = m.group(1);
            path = m.group(2);
        }

        host = host.toLowerCase(Locale.ROOT).replaceFirst("^(www\\.)+", "");
        if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        if (host.isBlank()) return null;

        if (path == null) path = "";
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return host + path;
    }

    public static String normalizeAddress(String address) {
        if (address == null) return null;
        String s = address.toLowerCase(Locale.ROOT);
        s = s.replaceAll("[.,#]", " ");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();

        for (Map.Entry<String, String> e : STATE_NAMES.entrySet()) {
            s = s.replaceAll("\\b" + e.getKey() + "\\b(?=\\s+\\d{5}|\\s*$)", e.getValue());
        }
        for (Map.Entry<String, String> e : ADDRESS_WORDS.entrySet()) {
            s = s.replaceAll("\\b" + e.getKey() + "\\b", e.getValue());
        }
        return s;
    }

    /**
     * Best-effort split of a US-style "street, city, ST 12345" address.
     */
    public static AddressParts parseAddress(String address) {
        if (address == null || address.isBlank()) return new AddressParts(null, null, null, null);

        String zip = null;
        Matcher zm = ZIP.matcher(address);
        while (zm.find()) {
            zip = zm.group(1);
        }

        String state = null;
        Matcher sm = STATE.matcher(address);
        while (sm.find()) {
            state = sm.group(1).toUpperCase(Locale.ROOT);
        }

        String[] parts = address.split(",");
        String street = null;
        String city = null;
        if (parts.length >= 2) {
            street = blankToNull(parts[0]);
            String cityPart = parts[1];
            if (parts.length == 2) {
                cityPart = STATE_ZIP_TAIL.matcher(cityPart).replaceFirst("");
            }
            city = blankToNull(cityPart);
        } else if (parts[0].matches("^\\s*\\d+\\s+.*")) {
            street = blankToNull(STATE_ZIP_TAIL.matcher(parts[0]).replaceFirst(""));
        }

        return new AddressParts(street, city, state, zip);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
