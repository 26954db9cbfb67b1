package com.mike.leadscout.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs independent source tasks concurrently and folds their outcomes into {@link PartialResults}.
 * A failing task becomes a failed outcome; it never cancels its siblings.
 */
@Component
@Slf4j
public class PartialResultsExecutor {

    private final ExecutorService executor;

    public PartialResultsExecutor(@Qualifier("leadSourceExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Runs all tasks and hands each outcome to {@code onComplete} on the calling thread, in completion order.
     */
    public <T> List<SourceOutcome<T>> runEach(List<SourceTask<T>> tasks, Consumer<SourceOutcome<T>> onComplete) {
        List<SourceOutcome<T>> outcomes = new ArrayList<>();
        if (tasks == null || tasks.isEmpty()) return outcomes;

        CompletionService<SourceOutcome<T>> completion = new ExecutorCompletionService<>(executor);
        List<Future<SourceOutcome<T>>> futures = new ArrayList<>();
        for (SourceTask<T> task : tasks) {
            futures.add(completion.submit(() -> runOne(task)));
        }

        try {
            for (int i = 0; i < tasks.size(); i++) {
                SourceOutcome<T> outcome = completion.take().get();
                outcomes.add(outcome);
                if (onComplete != null) onComplete.accept(outcome);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new JobCancelledException("Interrupted while waiting for sources");
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new LeadScoutException(null, "Source task crashed", e.getCause());
        } catch (RuntimeException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
        return outcomes;
    }

    public <T> PartialResults<T> runAll(List<SourceTask<T>> tasks, int minSuccess) {
        return summarize(runEach(tasks, null), minSuccess);
    }

    /**
     * Runs one task on the calling thread and records its outcome.
     */
    public <T> SourceOutcome<T> runOne(SourceTask<T> task) {
        long start = System.currentTimeMillis();
        try {
            List<T> data = task.action().call();
            return SourceOutcome.ok(task, data, System.currentTimeMillis() - start);
        } catch (JobCancelledException e) {
            throw e;
        } catch (Exception e) {
            log.warn("PartialResultsExecutor: source {} failed: {}", task.name(), e.getMessage());
            return SourceOutcome.failed(task, e, System.currentTimeMillis() - start);
        }
    }

    /**
     * Folds outcomes into an aggregate. Throws when fewer than {@code minSuccess} sources succeeded
     * or a required source failed. Circuit-open skips count against the minimum but never as a
     * required-source failure; when they leave the run short, the exception message names them.
     */
    public static <T> PartialResults<T> summarize(List<SourceOutcome<T>> outcomes, int minSuccess) {
        PartialResults.PartialResultsBuilder<T> builder = PartialResults.builder();
        int successes = 0;
        List<String> requiredFailures = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (SourceOutcome<T> o : outcomes) {
            if (o.success()) {
                successes++;
                builder.data(o.data());
            } else {
                builder.failedSource(o.source());
                builder.error(o.source(), o.error() == null ? "unknown" : String.valueOf(o.error().getMessage()));
                if (o.skipped()) skipped.add(o.source());
                if (o.required() && !o.skipped()) requiredFailures.add(o.source());
            }
        }

        int failed = outcomes.size() - successes;
        PartialResults<T> results = builder
                .totalSources(outcomes.size())
                .successfulSources(successes)
                .partialFailure(failed > 0)
                .build();

        if (!requiredFailures.isEmpty()) {
            throw new PartialResultsException("Required sources failed: " + requiredFailures, results);
        }
        if (successes < minSuccess) {
            String message = "Only " + successes + " of " + outcomes.size() + " sources succeeded (minimum " + minSuccess + ")";
            if (!outcomes.isEmpty() && skipped.size() == outcomes.size()) {
                message += "; every source was skipped with its circuit open: " + skipped;
            } else if (!skipped.isEmpty()) {
                message += "; skipped with circuit open: " + skipped;
            }
            throw new PartialResultsException(message, results);
        }
        return results;
    }
}
