package com.mike.leadscout.email.phase;

import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.extract.EmailFilter;
import com.mike.leadscout.email.provider.DomainContact;
import com.mike.leadscout.email.provider.WhoisXmlClient;
import com.mike.leadscout.resilience.CircuitOpenException;
import com.mike.leadscout.resilience.SourceGuard;
import com.mike.leadscout.util.Domains;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Registrant, admin or tech contact of the domain registration, unless it is a privacy proxy
 * or a free-mail address.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DomainRecordPhase implements CascadePhase {

    static final List<String> PRIVACY_MARKERS = List.of(
            "privacy", "proxy", "whoisguard", "redacted", "protect", "anonymi", "withheld", "domainsbyproxy"
    );

    private final WhoisXmlClient whoisClient;
    private final SourceGuard guard;
    private final ConfidenceTable confidenceTable;

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.DOMAIN_RECORD;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return lookup.hasDomain() && whoisClient.isEnabled();
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        List<DomainContact> contacts;
        try {
            contacts = guard.call("provider:" + WhoisXmlClient.NAME, () -> whoisClient.lookup(lookup.getDomain()));
        } catch (CircuitOpenException e) {
            log.info("DomainRecordPhase: whois circuit open, skipping {}", lookup.getDomain());
            return null;
        }

        for (DomainContact contact : contacts) {
            if (!isUsable(contact.email())) continue;
            return EmailCandidate.of(contact.email(), confidenceTable.domainRecordConfidence(contact.role()),
                    phase(), Evidence.DISCOVERED, contact.role());
        }
        return null;
    }

    static boolean isUsable(String email) {
        if (!EmailFilter.isAcceptable(email) || EmailFilter.isGenericProvider(email)) return false;
        String lower = email.toLowerCase(Locale.ROOT);
        String domain = Domains.emailDomain(lower);
        return domain != null && PRIVACY_MARKERS.stream().noneMatch(lower::contains);
    }
}
