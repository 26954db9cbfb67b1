package com.mike.leadscout.resilience;

import java.util.List;
import java.util.concurrent.Callable;

public record SourceTask<T>(
        String name,
        Callable<List<T>> action,
        boolean required
) {
    public static <T> SourceTask<T> optional(String name, Callable<List<T>> action) {
        return new SourceTask<>(name, action, false);
    }
}
