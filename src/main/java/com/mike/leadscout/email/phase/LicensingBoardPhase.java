package com.mike.leadscout.email.phase;

import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.extract.EmailFilter;
import com.mike.leadscout.quality.BusinessNormalizer;
import com.mike.leadscout.util.Domains;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Searches state licensing and registration listings for the business. Runs only when the
 * address yields a state. Board and agency addresses (.gov) are ignored.
 */
@Component
@RequiredArgsConstructor
public class LicensingBoardPhase implements CascadePhase {

    static final int MIN_NAME_TOKEN = 4;

    private final SearchEmails searchEmails;
    private final ConfidenceTable confidenceTable;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.LICENSING_BOARD;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return searchEmails.isEnabled()
                && lookup.businessName() != null
                && lookup.state() != null;
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        String name = lookup.businessName();
        String state = lookup.state();
        List<String> queries = List.of(
                "\"" + name + "\" " + state + " license board email",
                "\"" + name + "\" " + state + " professional license",
                "\"" + name + "\" " + state + " business registration contact"
        );
        String email = searchEmails.firstMatch(queries, e -> belongsToBusiness(e, lookup));
        if (email == null) return null;
        return EmailCandidate.of(email, confidenceTable.base(phase()), phase(), Evidence.DISCOVERED, state);
    }

    static boolean belongsToBusiness(String email, EmailLookup lookup) {
        String mailDomain = Domains.emailDomain(email);
        if (mailDomain == null || EmailFilter.isGenericProvider(email)) return false;
        if (mailDomain.endsWith(".gov") || mailDomain.contains(".state.")) return false;
        if (lookup.getDomain() != null) return Domains.emailMatchesDomain(email, lookup.getDomain());

        String normalized = BusinessNormalizer.normalizeName(lookup.businessName());
        return normalized != null && Arrays.stream(normalized.split(" "))
                .filter(t -> t.length() >= MIN_NAME_TOKEN)
                .anyMatch(mailDomain::contains);
    }
}
