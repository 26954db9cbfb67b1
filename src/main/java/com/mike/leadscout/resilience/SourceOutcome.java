package com.mike.leadscout.resilience;

import java.util.List;

public record SourceOutcome<T>(
        String source,
        boolean success,
        List<T> data,
        Throwable error,
        long durationMs,
        boolean skipped,
        boolean required
) {
    public static <T> SourceOutcome<T> ok(SourceTask<T> task, List<T> data, long durationMs) {
        return new SourceOutcome<>(task.name(), true, data == null ? List.of() : data, null, durationMs, false, task.required());
    }

    public static <T> SourceOutcome<T> failed(SourceTask<T> task, Throwable error, long durationMs) {
        boolean skipped = error instanceof CircuitOpenException;
        return new SourceOutcome<>(task.name(), false, List.of(), error, durationMs, skipped, task.required());
    }

    public int size() {
        return data == null ? 0 : data.size();
    }
}
