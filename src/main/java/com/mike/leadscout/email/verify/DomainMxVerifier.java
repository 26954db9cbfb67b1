package com.mike.leadscout.email.verify;

import com.mike.leadscout.config.EmailProperties;
import com.mike.leadscout.util.Domains;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gate applied to published addresses before the cascade accepts them: the address's own mail
 * domain must have a mail exchanger. DNS answers that are neither yes nor no follow
 * {@code leadscout.email.mx-unknown-policy}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DomainMxVerifier {
    private final MxLookUp mxLookUp;
    private final EmailProperties props;

    public boolean accepts(String email) {
        if (!props.mxCheckEnabled()) return true;

        String mailDomain = Domains.emailDomain(email);
        if (mailDomain == null) return false;

        MxLookUp.MxStatus mx = mxLookUp.checkDomain(mailDomain);
        if (mx == MxLookUp.MxStatus.VALID) return true;
        if (mx == MxLookUp.MxStatus.INVALID) {
            log.info("DomainMxVerifier: {} has no mail exchanger, dropping {}", mailDomain, email);
            return false;
        }

        if (props.mxUnknownPolicy() == EmailProperties.MxUnknownPolicy.DROP) {
            log.info("DomainMxVerifier: MX unknown for {}, dropping {}", mailDomain, email);
            return false;
        }
        if (props.mxUnknownPolicy() != EmailProperties.MxUnknownPolicy.ALLOW) {
            log.warn("DomainMxVerifier: MX check UNKNOWN for domain={}, email={}", mailDomain, email);
        }
        return true;
    }
}
