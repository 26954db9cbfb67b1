package com.mike.leadscout.email.verify;

import com.mike.leadscout.util.Domains;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * MX + SMTP verification of a single address, and an MX-only quick check.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailboxVerifier {

    static final double SMTP_PASSED = 0.95;
    static final double SMTP_FAILED = 0.2;
    static final double INCONCLUSIVE_COMMON = 0.85;
    static final double INCONCLUSIVE_OTHER = 0.7;
    static final double NO_MX = 0.1;

    static final double QUICK_COMMON = 0.85;
    static final double QUICK_OTHER = 0.75;
    static final double QUICK_NO_MX = 0.2;

    private static final int MAX_MX_HOSTS = 2;

    static final Set<String> COMMON_PREFIXES = Set.of(
            "info", "contact", "hello", "office", "mail", "admin", "support", "reception"
    );

    private final MxLookUp mxLookUp;
    private final SmtpProbe smtpProbe;

    public MailboxVerification verify(String email) {
        String domain = Domains.emailDomain(email);
        if (domain == null) {
            return new MailboxVerification(email, false, NO_MX, MailboxCheck.NO_MX, false);
        }

        MxLookUp.MxStatus status = mxLookUp.checkDomain(domain);
        if (status == MxLookUp.MxStatus.INVALID) {
            return new MailboxVerification(email, false, NO_MX, MailboxCheck.NO_MX, false);
        }
        boolean mxValid = status == MxLookUp.MxStatus.VALID;

        if (smtpProbe.isEnabled() && mxValid) {
            List<String> hosts = mxLookUp.mxHosts(domain);
            for (String host : hosts.subList(0, Math.min(MAX_MX_HOSTS, hosts.size()))) {
                SmtpVerdict verdict = smtpProbe.probe(host, email);
                if (verdict == SmtpVerdict.ACCEPTED) {
                    return new MailboxVerification(email, true, SMTP_PASSED, MailboxCheck.PASSED, true);
                }
                if (verdict == SmtpVerdict.REJECTED) {
                    return new MailboxVerification(email, false, SMTP_FAILED, MailboxCheck.FAILED, true);
                }
            }
        }

        double confidence = isCommonPrefix(email) ? INCONCLUSIVE_COMMON : INCONCLUSIVE_OTHER;
        return new MailboxVerification(email, true, confidence, MailboxCheck.INCONCLUSIVE, mxValid);
    }

    /**
     * DNS only, no SMTP conversation.
     */
    public MailboxVerification quickVerify(String email) {
        String domain = Domains.emailDomain(email);
        MxLookUp.MxStatus status = domain == null ? MxLookUp.MxStatus.INVALID : mxLookUp.checkDomain(domain);
        if (status != MxLookUp.MxStatus.VALID) {
            return new MailboxVerification(email, false, QUICK_NO_MX, MailboxCheck.NO_MX, false);
        }
        double confidence = isCommonPrefix(email) ? QUICK_COMMON : QUICK_OTHER;
        return new MailboxVerification(email, true, confidence, MailboxCheck.INCONCLUSIVE, true);
    }

    static boolean isCommonPrefix(String email) {
        int at = email == null ? -1 : email.indexOf('@');
        return at > 0 && COMMON_PREFIXES.contains(email.substring(0, at).toLowerCase(Locale.ROOT));
    }
}
