package com.mike.leadscout.email;

/**
 * One discovery strategy. Implementations return null when they found nothing; the cascade
 * runner treats a thrown exception the same way, except for job cancellation.
 */
public interface CascadePhase {

    DiscoveryPhase phase();

    /**
     * Cheap precondition, checked before {@link #attempt(EmailLookup)}.
     */
    default boolean appliesTo(EmailLookup lookup) {
        return lookup.hasDomain();
    }

    EmailCandidate attempt(EmailLookup lookup);
}
