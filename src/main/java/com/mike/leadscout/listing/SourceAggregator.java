package com.mike.leadscout.listing;

import com.mike.leadscout.config.DiscoveryProperties;
import com.mike.leadscout.config.ResilienceProperties;
import com.mike.leadscout.quality.RawListing;
import com.mike.leadscout.resilience.CancellationToken;
import com.mike.leadscout.resilience.PartialResults;
import com.mike.leadscout.resilience.PartialResultsExecutor;
import com.mike.leadscout.resilience.SourceGuard;
import com.mike.leadscout.resilience.SourceOutcome;
import com.mike.leadscout.resilience.SourceTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects raw listings from the registered listing sources, group by group in priority order,
 * until enough listings exist or the plan is exhausted.
 */
@Service
@Slf4j
public class SourceAggregator {

    static final String GUARD_PREFIX = "source:";

    private final List<ListingSource> sources;
    private final SourcePrioritizer prioritizer;
    private final SourceGuard guard;
    private final PartialResultsExecutor executor;
    private final DiscoveryProperties discovery;
    private final ResilienceProperties resilience;

    public SourceAggregator(List<ListingSource> sources,
                            SourcePrioritizer prioritizer,
                            SourceGuard guard,
                            PartialResultsExecutor executor,
                            DiscoveryProperties discovery,
                            ResilienceProperties resilience) {
        this.sources = sources;
        this.prioritizer = prioritizer;
        this.guard = guard;
        this.executor = executor;
        this.discovery = discovery;
        this.resilience = resilience;
    }

    public PartialResults<RawListing> discover(String query, String location, int targetCount, ProgressListener onProgress) {
        return discover(query, location, targetCount, onProgress, CancellationToken.none());
    }

    /**
     * @throws com.mike.leadscout.resilience.PartialResultsException when fewer sources than
     *                                                                configured succeeded, including
     *                                                                when every circuit is open
     * @throws com.mike.leadscout.resilience.JobCancelledException  when the token fires between sources
     */
    public PartialResults<RawListing> discover(String query,
                                               String location,
                                               int targetCount,
                                               ProgressListener onProgress,
                                               CancellationToken token) {
        ProgressListener progress = onProgress == null ? ProgressListener.NONE : onProgress;
        int goal = goal(targetCount);
        Map<String, ListingSource> enabled = enabledSources();
        if (enabled.isEmpty()) {
            log.warn("SourceAggregator: no listing source is enabled");
        }

        List<List<SourceDescriptor>> groups = prioritizer.plan(query, location, enabled.keySet());
        Run run = new Run(goal, groups.stream().mapToInt(List::size).sum(), progress);
        log.info("SourceAggregator: query='{}', location='{}', target={}, goal={}", query, location, targetCount, goal);

        for (List<SourceDescriptor> group : groups) {
            token.throwIfCancelled();
            if (run.isSatisfied()) {
                log.info("SourceAggregator: goal of {} listings reached, skipping remaining groups", goal);
                break;
            }

            List<SourceDescriptor> wanted = SourcePrioritizer.filterByResultCount(group, run.collected());
            if (wanted.size() < group.size()) {
                log.info("SourceAggregator: {} source(s) skipped, {} listings already collected",
                        group.size() - wanted.size(), run.collected());
            }

            List<SourceTask<RawListing>> parallel = new ArrayList<>();
            List<SourceDescriptor> sequential = new ArrayList<>();
            for (SourceDescriptor d : wanted) {
                if (d.parallel()) {
                    parallel.add(task(enabled.get(d.sourceId()), query, location, run.remaining()));
                } else {
                    sequential.add(d);
                }
            }

            executor.runEach(parallel, run::accept);

            for (SourceDescriptor d : sequential) {
                token.throwIfCancelled();
                if (run.isSatisfied() || !d.isWanted(run.collected())) continue;
                run.accept(executor.runOne(task(enabled.get(d.sourceId()), query, location, run.remaining())));
            }
        }

        PartialResults<RawListing> results = PartialResultsExecutor.summarize(run.outcomes, minSuccessfulSources());
        log.info("SourceAggregator: {} listings from {}/{} sources (failed: {})",
                results.getData().size(), results.getSuccessfulSources(), results.getTotalSources(), results.getFailedSources());
        return results;
    }

    int goal(int targetCount) {
        double factor = discovery.overfetchFactor() > 0 ? discovery.overfetchFactor() : 1.0;
        return (int) Math.ceil(Math.max(1, targetCount) * factor);
    }

    private SourceTask<RawListing> task(ListingSource source, String query, String location, int limit) {
        String id = source.id();
        ProgressListener inner = (message, fraction) -> log.debug("SourceAggregator: {} {}", id, message);
        return SourceTask.optional(id, () -> stamp(id,
                guard.call(GUARD_PREFIX + id, () -> source.discoverBusinesses(query, location, limit, inner))));
    }

    private static List<RawListing> stamp(String sourceId, List<RawListing> listings) {
        if (listings == null) return List.of();
        return listings.stream()
                .filter(l -> l != null && l.getName() != null && !l.getName().isBlank())
                .map(l -> l.getSourceId() == null ? l.toBuilder().sourceId(sourceId).build() : l)
                .toList();
    }

    private Map<String, ListingSource> enabledSources() {
        Map<String, ListingSource> out = new LinkedHashMap<>();
        for (ListingSource s : sources) {
            if (s.isEnabled()) out.putIfAbsent(s.id(), s);
        }
        return out;
    }

    private int minSuccessfulSources() {
        return Math.max(1, resilience.minSuccessfulSources());
    }

    private final class Run {
        private final int goal;
        private final int planned;
        private final ProgressListener progress;
        private final List<SourceOutcome<RawListing>> outcomes = new ArrayList<>();
        private int collected;

        private Run(int goal, int planned, ProgressListener progress) {
            this.goal = goal;
            this.planned = Math.max(1, planned);
            this.progress = progress;
        }

        void accept(SourceOutcome<RawListing> outcome) {
            outcomes.add(outcome);
            if (!outcome.skipped()) prioritizer.recordYield(outcome.source(), outcome.size());
            collected += outcome.size();

            String message = outcome.success()
                    ? outcome.source() + ": " + outcome.size() + " listings (" + collected + " total)"
                    : outcome.source() + (outcome.skipped() ? ": skipped (circuit open)" : ": failed");
            progress.onProgress(message, Math.min(1.0, (double) outcomes.size() / planned));
        }

        int collected() {
            return collected;
        }

        int remaining() {
            return Math.max(1, goal - collected);
        }

        boolean isSatisfied() {
            return collected >= goal;
        }
    }
}
