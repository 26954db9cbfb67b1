package com.mike.leadscout.email.verify;

import com.mike.leadscout.cache.EmailCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Probes whether a domain's mail server accepts any local part. Definitive answers are cached per domain;
 * inconclusive probes count as "not catch-all" and are retried next time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatchAllDetector {

    private final MxLookUp mxLookUp;
    private final SmtpProbe smtpProbe;
    private final EmailCache emailCache;

    public boolean isCatchAll(String domain) {
        if (domain == null) return false;

        Boolean cached = emailCache.catchAll(domain);
        if (cached != null) return cached;

        if (!smtpProbe.isEnabled()) return false;

        List<String> hosts = mxLookUp.mxHosts(domain);
        if (hosts.isEmpty()) return false;

        String probe = randomLocalPart() + "@" + domain;
        SmtpVerdict verdict = smtpProbe.probe(hosts.get(0), probe);
        if (verdict == SmtpVerdict.UNKNOWN) {
            log.debug("CatchAllDetector: inconclusive probe for {}", domain);
            return false;
        }

        boolean catchAll = verdict == SmtpVerdict.ACCEPTED;
        emailCache.storeCatchAll(domain, catchAll);
        if (catchAll) {
            log.info("CatchAllDetector: {} accepts any recipient", domain);
        }
        return catchAll;
    }

    static String randomLocalPart() {
        return "probe_" + System.currentTimeMillis() + "_" + Integer.toString(ThreadLocalRandom.current().nextInt(1 << 30), 36);
    }
}
