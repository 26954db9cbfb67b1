package com.mike.leadscout.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public final class Domains {

    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern LEADING_WWW = Pattern.compile("^(www\\.)+");

    private Domains() {
    }

    /**
     * Host of a URL or bare host, lower-cased, without "www." prefixes, port or trailing dot.
     * Returns null for blank input or when no host can be recovered.
     */
    public static String extractDomain(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;

        String s = urlOrHost.trim().toLowerCase(Locale.ROOT);
        if (!SCHEME.matcher(s).find()) {
            s = "https://" + s;
        }

        String host;
        try {
            host = new URI(s).getHost();
        } catch (URISyntaxException e) {
            // hosts with underscores or spaces; fall back to cutting the string
            host = null;
        }

        if (host == null) {
            String stripped = SCHEME.matcher(s).replaceFirst("");
            int cut = indexOfAny(stripped, '/', '?', '#', ':');
            host = cut >= 0 ? stripped.substring(0, cut) : stripped;
        }

        host = LEADING_WWW.matcher(host).replaceFirst("");
        if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        if (host.isBlank() || !host.contains(".")) return null;
        return host;
    }

    public static String toBaseUrl(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String s = urlOrHost.trim();
        if (!SCHEME.matcher(s.toLowerCase(Locale.ROOT)).find()) {
            s = "https://" + s;
        }
        try {
            URI uri = new URI(s);
            if (uri.getHost() == null) return null;
            return uri.getScheme() + "://" + uri.getHost();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isSameDomain(String baseUrl, String otherUrl) {
        String a = extractDomain(baseUrl);
        String b = extractDomain(otherUrl);
        return a != null && Objects.equals(a, b);
    }

    /**
     * True when the email's host is the domain itself or one of its subdomains.
     */
    public static boolean emailMatchesDomain(String email, String domain) {
        if (email == null || domain == null) return false;
        int at = email.lastIndexOf('@');
        if (at < 0) return false;
        String host = email.substring(at + 1).toLowerCase(Locale.ROOT);
        String d = domain.toLowerCase(Locale.ROOT);
        return host.equals(d) || host.endsWith("." + d);
    }

    public static String emailDomain(String email) {
        if (email == null) return null;
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) return null;
        return email.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    private static int indexOfAny(String s, char... chars) {
        int best = -1;
        for (char c : chars) {
            int i = s.indexOf(c);
            if (i >= 0 && (best < 0 || i < best)) best = i;
        }
        return best;
    }
}
