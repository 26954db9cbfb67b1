package com.mike.leadscout.email.extract;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Raw candidate -> {@code local@host.tld} in lower case, or null when it cannot be an address.
 */
@Component
@RequiredArgsConstructor
public class EmailCanonicalizer {

    private final EmailNormalizer normalizer;
    private final EmailValidator validator;

    public String canonicalize(String raw) {
        String email = normalizer.normalizeRawCandidate(raw);
        if (email == null) return null;

        int atIndex = email.indexOf('@');
        int lastDot = email.lastIndexOf('.');
        if (atIndex <= 0 || lastDot <= atIndex) return null;
        if (email.indexOf('@', atIndex + 1) != -1) return null;

        String localPart = normalizer.normalizeLocalPart(email.substring(0, atIndex));
        if (!validator.isLocalPartAllowed(localPart)) return null;

        String hostWithoutTld = email.substring(atIndex + 1, lastDot).trim();
        if (!validator.isHostWithoutTldAllowed(hostWithoutTld)) return null;

        String tld = validator.extractKnownTld(email.substring(lastDot + 1).trim());
        if (tld == null) return null;

        return localPart + "@" + hostWithoutTld.toLowerCase(Locale.ROOT) + "." + tld;
    }
}
