package com.mike.leadscout.email.phase;

import com.mike.leadscout.browser.BrowserSession;
import com.mike.leadscout.config.CascadeProperties;
import com.mike.leadscout.crawl.SocialPlatform;
import com.mike.leadscout.email.CascadePhase;
import com.mike.leadscout.email.ConfidenceTable;
import com.mike.leadscout.email.DiscoveryPhase;
import com.mike.leadscout.email.EmailCandidate;
import com.mike.leadscout.email.EmailLookup;
import com.mike.leadscout.email.Evidence;
import com.mike.leadscout.email.extract.EmailHarvester;
import com.mike.leadscout.email.extract.HarvestedEmail;
import com.mike.leadscout.resilience.LeadScoutException;
import com.mike.leadscout.util.Domains;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Facebook, then Instagram, then LinkedIn profile pages, taken from the listing or from links on
 * the business website. An address on the business's own domain is preferred when there is one.
 */
@Component
@Slf4j
public class SocialProfilePhase implements CascadePhase {

    private final EmailHarvester harvester;
    private final ConfidenceTable confidenceTable;
    private final Duration pageTimeout;

    public SocialProfilePhase(EmailHarvester harvester, ConfidenceTable confidenceTable, CascadeProperties props) {
        this.harvester = harvester;
        this.confidenceTable = confidenceTable;
        this.pageTimeout = props.getCrawl().getPageTimeout();
    }

    @Override
    public DiscoveryPhase phase() {
        return DiscoveryPhase.SOCIAL;
    }

    @Override
    public boolean appliesTo(EmailLookup lookup) {
        return lookup.getCrawlState().isEmpty() && !profiles(lookup).isEmpty();
    }

    @Override
    public EmailCandidate attempt(EmailLookup lookup) {
        for (Map.Entry<SocialPlatform, String> profile : profiles(lookup).entrySet()) {
            lookup.getToken().throwIfCancelled();
            String email = scan(lookup, profile.getKey(), profile.getValue());
            if (email != null) {
                return EmailCandidate.of(email, confidenceTable.base(phase()), phase(), Evidence.DISCOVERED,
                        profile.getKey().key());
            }
        }
        return null;
    }

    private String scan(EmailLookup lookup, SocialPlatform platform, String profileUrl) {
        String url = platform.aboutUrl(profileUrl);
        try {
            BrowserSession session = lookup.session();
            if (!session.navigate(url, pageTimeout)) return null;

            List<HarvestedEmail> found = harvester.harvest(session.snapshot());
            if (found.isEmpty()) return null;
            if (lookup.getDomain() != null) {
                for (HarvestedEmail h : found) {
                    if (Domains.emailMatchesDomain(h.email(), lookup.getDomain())) return h.email();
                }
            }
            log.info("SocialProfilePhase: {} lists {}", url, found.get(0).email());
            return found.get(0).email();
        } catch (LeadScoutException e) {
            log.info("SocialProfilePhase: cannot read {} profile {}: {}", platform.key(), url, e.getMessage());
            return null;
        }
    }

    /**
     * One profile URL per platform, listing data first, then links seen while crawling.
     */
    static Map<SocialPlatform, String> profiles(EmailLookup lookup) {
        Map<SocialPlatform, String> out = new EnumMap<>(SocialPlatform.class);
        Map<String, String> listed = lookup.getBusiness().getSocialProfiles();
        if (listed != null) {
            listed.values().forEach(url -> put(out, url));
        }
        lookup.getCrawlState().socialLinks().values().forEach(url -> put(out, url));
        return out;
    }

    private static void put(Map<SocialPlatform, String> out, String url) {
        if (url == null || !SocialPlatform.isProfileLink(url)) return;
        SocialPlatform platform = SocialPlatform.of(url);
        if (platform == null) return;
        String absolute = url.startsWith("http") ? url : "https://" + url;
        out.putIfAbsent(platform, absolute);
    }
}
