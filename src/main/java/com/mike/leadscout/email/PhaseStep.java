package com.mike.leadscout.email;

public record PhaseStep(
        DiscoveryPhase phase,
        CascadePhase attempt,
        double minAccept
) {
}
