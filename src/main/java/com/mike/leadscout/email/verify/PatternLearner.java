package com.mike.leadscout.email.verify;

import com.mike.leadscout.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Remembers, per domain, which name-to-local-part convention a confirmed address followed.
 */
@Component
@Slf4j
public class PatternLearner {

    static final double BOOST_ONE_CONFIRMATION = 0.05;
    static final double BOOST_TWO_OR_MORE = 0.10;

    static final List<EmailPattern> DEFAULT_ORDER = List.of(
            EmailPattern.FIRST_DOT_LAST,
            EmailPattern.FIRSTLAST,
            EmailPattern.FLAST,
            EmailPattern.FIRST,
            EmailPattern.F_DOT_LAST,
            EmailPattern.FIRSTL,
            EmailPattern.LAST_DOT_FIRST,
            EmailPattern.LASTFIRST
    );

    private final KeyValueStore<String, LearnedPattern> store;
    private final Clock clock;

    public PatternLearner(@Qualifier("patternStore") KeyValueStore<String, LearnedPattern> store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * First pattern whose output equals the local part, or null.
     */
    public static EmailPattern detect(String localPart, String first, String last) {
        String f = sanitize(first);
        String l = sanitize(last);
        if (localPart == null || f.isEmpty() || l.isEmpty()) return null;
        String lp = localPart.toLowerCase(Locale.ROOT);
        for (EmailPattern p : EmailPattern.values()) {
            if (lp.equals(p.apply(f, l))) return p;
        }
        return null;
    }

    /**
     * Candidate addresses for a person, learned pattern first, then the common conventions.
     */
    public List<NameGuess> variations(String domain, String first, String last) {
        String f = sanitize(first);
        String l = sanitize(last);
        List<NameGuess> out = new ArrayList<>();
        if (f.isEmpty() || l.isEmpty() || domain == null) return out;

        Set<EmailPattern> order = new LinkedHashSet<>();
        LearnedPattern learned = store.get(domain);
        if (learned != null) order.add(learned.pattern());
        order.addAll(DEFAULT_ORDER);

        Set<String> seen = new LinkedHashSet<>();
        for (EmailPattern p : order) {
            String local = p.apply(f, l);
            if (local != null && seen.add(local)) {
                out.add(new NameGuess(p, local + "@" + domain));
            }
        }
        return out;
    }

    public void learn(String domain, String email, String first, String last) {
        if (domain == null || email == null) return;
        int at = email.indexOf('@');
        if (at <= 0) return;

        EmailPattern pattern = detect(email.substring(0, at), first, last);
        if (pattern == null) return;

        LearnedPattern current = store.get(domain);
        int confirmations = current != null && current.pattern() == pattern ? current.confirmations() + 1 : 1;
        store.put(domain, new LearnedPattern(pattern, confirmations, clock.instant()));
        log.info("PatternLearner: {} uses {} ({} confirmation(s))", domain, pattern.label(), confirmations);
    }

    public double boost(String domain, EmailPattern pattern) {
        if (domain == null || pattern == null) return 0.0;
        LearnedPattern learned = store.get(domain);
        if (learned == null || learned.pattern() != pattern) return 0.0;
        if (learned.confirmations() >= 2) return BOOST_TWO_OR_MORE;
        return learned.confirmations() == 1 ? BOOST_ONE_CONFIRMATION : 0.0;
    }

    public LearnedPattern learned(String domain) {
        return domain == null ? null : store.get(domain);
    }

    static String sanitize(String name) {
        if (name == null) return "";
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
