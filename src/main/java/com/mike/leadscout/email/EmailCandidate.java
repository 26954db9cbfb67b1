package com.mike.leadscout.email;

/**
 * What one phase proposes. Confidence is the phase's own estimate, before catch-all adjustment.
 *
 * @param detail       sub-source, e.g. provider name or page path
 * @param catchAllHint catch-all verdict reported by the source, null when it did not say
 */
public record EmailCandidate(
        String email,
        double confidence,
        DiscoveryPhase phase,
        Evidence evidence,
        String detail,
        Boolean catchAllHint
) {
    public static EmailCandidate of(String email, double confidence, DiscoveryPhase phase, Evidence evidence, String detail) {
        return new EmailCandidate(email, confidence, phase, evidence, detail, null);
    }

    public EmailCandidate withCatchAllHint(Boolean hint) {
        return new EmailCandidate(email, confidence, phase, evidence, detail, hint);
    }

    public String source() {
        return detail == null || detail.isBlank() ? phase.label() : phase.label() + ":" + detail;
    }
}
