package com.mike.leadscout.email.phase;

import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.extract.EmailFilter;
import com.mike.leadscout.util.Domains;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Searches the open web for the business and keeps only addresses on its own domain.
 */
@Component
@RequiredArgsConstructor
public class WebSearchPhase implements CascadePhase {

    private final SearchEmails searchEmails;
    private final ConfidenceTable confidenceTable;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.WEB_SEARCH;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return lookup.hasDomain() && searchEmails.isEnabled();
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        String domain = lookup.getDomain();
        String email = searchEmails.firstMatch(queries(lookup.businessName(), domain),
                e -> Domains.emailMatchesDomain(e, domain) && !EmailFilter.isGenericProvider(e));
        if (email == null) return null;
        return EmailCandidate.of(email, confidenceTable.base(phase()), phase(), Evidence.DISCOVERED, null);
    }

    static List<String> queries(String businessName, String domain) {
        List<String> queries = new ArrayList<>();
        if (businessName != null && !businessName.isBlank()) {
            queries.add("\"" + businessName + "\" email");
            queries.add("\"" + businessName + "\" contact email");
        }
        queries.add("site:" + domain + " email");
        queries.add("\"@" + domain + "\"");
        return queries;
    }
}
