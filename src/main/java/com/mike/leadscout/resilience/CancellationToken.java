package com.mike.leadscout.resilience;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a job. Checked between sources and between cascade phases.
 */
public class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, Clock.systemUTC());

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant deadline;
    private final Clock clock;

    public CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock);
    }

    public void cancel() {
        if (this == NONE) return;
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) return true;
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public void throwIfCancelled() {
        if (!isCancelled()) return;
        if (cancelled.get()) {
            throw new JobCancelledException("Job cancelled");
        }
        throw new JobCancelledException("Job time ceiling reached at " + deadline);
    }
}
