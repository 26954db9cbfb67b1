package com.mike.leadscout.service;

import com.mike.leadscout.config.ConcurrencyConfig;
import com.mike.leadscout.config.DiscoveryProperties;
import com.mike.leadscout.email.EmailDiscoveryCascade;
import com.mike.leadscout.email.EmailResult;
import com.mike.leadscout.listing.ProgressListener;
import com.mike.leadscout.listing.SourceAggregator;
import com.mike.leadscout.quality.CanonicalBusiness;
import com.mike.leadscout.quality.DeduplicationEngine;
import com.mike.leadscout.quality.DeduplicationResult;
import com.mike.leadscout.quality.RawListing;
import com.mike.leadscout.resilience.CancellationToken;
import com.mike.leadscout.resilience.JobCancelledException;
import com.mike.leadscout.resilience.PartialResults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for a lead job: discover listings, merge them, then resolve an email per business.
 */
@Service
@Slf4j
public class LeadScoutService {

    static final double DISCOVERY_SHARE = 0.4;

    private final SourceAggregator aggregator;
    private final DeduplicationEngine deduplicationEngine;
    private final EmailDiscoveryCascade cascade;
    private final DiscoveryProperties props;
    private final Clock clock;

    public LeadScoutService(SourceAggregator aggregator,
                            DeduplicationEngine deduplicationEngine,
                            EmailDiscoveryCascade cascade,
                            DiscoveryProperties props,
                            Clock clock) {
        this.aggregator = aggregator;
        this.deduplicationEngine = deduplicationEngine;
        this.cascade = cascade;
        this.props = props;
        this.clock = clock;
    }

    public List<CanonicalBusiness> discoverAndDeduplicate(String query, String location, int count, ProgressListener onProgress) {
        return discoverAndDeduplicate(query, location, count, onProgress, CancellationToken.none());
    }

    public List<CanonicalBusiness> discoverAndDeduplicate(String query,
                                                          String location,
                                                          int count,
                                                          ProgressListener onProgress,
                                                          CancellationToken token) {
        ProgressListener progress = onProgress == null ? ProgressListener.NONE : onProgress;
        PartialResults<RawListing> listings = aggregator.discover(query, location, count, progress, token);
        if (listings.isPartialFailure()) {
            log.warn("LeadScoutService: partial source failure, failed={}", listings.getFailedSources());
        }

        int max = props.maxResults() > 0 ? Math.min(count, props.maxResults()) : count;
        DeduplicationResult result = deduplicationEngine.processBatch(listings.getData(), props.minQualityScore(), max);
        log.info("LeadScoutService: {} listings -> {} businesses (duplicates={})",
                listings.getData().size(), result.unique().size(), result.duplicates().size());
        progress.onProgress("Deduplicated " + result.unique().size() + " businesses", 1.0);
        return result.unique();
    }

    public EmailResult resolveEmail(CanonicalBusiness business) {
        return cascade.resolve(business);
    }

    /**
     * Discovers and deduplicates, then runs the email cascade for every business without a verified
     * email on a per-job worker pool. Results stream through {@code onProgress}. When the job time
     * ceiling is reached the businesses resolved so far are returned and the rest keep no email result.
     */
    public List<CanonicalBusiness> enrich(String query, String location, int count, ProgressListener onProgress) {
        ProgressListener progress = onProgress == null ? ProgressListener.NONE : onProgress;
        Duration ceiling = props.jobTimeout() == null ? Duration.ofMinutes(10) : props.jobTimeout();
        Instant deadline = clock.instant().plus(ceiling);
        CancellationToken token = CancellationToken.withDeadline(deadline, clock);

        List<CanonicalBusiness> businesses = discoverAndDeduplicate(query, location, count,
                scaled(progress, 0.0, DISCOVERY_SHARE), token);
        return resolveAll(businesses, progress, token, deadline);
    }

    List<CanonicalBusiness> resolveAll(List<CanonicalBusiness> businesses,
                                       ProgressListener progress,
                                       CancellationToken token,
                                       Instant deadline) {
        List<CanonicalBusiness> out = new ArrayList<>(businesses);
        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < businesses.size(); i++) {
            if (!businesses.get(i).hasVerifiedEmail()) pending.add(i);
        }
        if (pending.isEmpty()) {
            progress.onProgress("No business needs an email lookup", 1.0);
            return out;
        }

        log.info("LeadScoutService: resolving emails for {} of {} businesses (workers={})",
                pending.size(), businesses.size(), props.workers());
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, props.workers()), ConcurrencyConfig.named("cascade"));
        CompletionService<Resolved> completion = new ExecutorCompletionService<>(pool);
        Map<Future<Resolved>, Integer> submitted = new HashMap<>();
        try {
            for (int index : pending) {
                CanonicalBusiness business = businesses.get(index);
                submitted.put(completion.submit(() -> new Resolved(index, cascade.resolve(business, token))), index);
            }

            int done = 0;
            int found = 0;
            while (done < pending.size()) {
                long waitMs = Duration.between(clock.instant(), deadline).toMillis();
                Future<Resolved> next = waitMs > 0 ? completion.poll(waitMs, TimeUnit.MILLISECONDS) : null;
                if (next == null) {
                    log.warn("LeadScoutService: job time ceiling reached, {} of {} lookups unfinished",
                            pending.size() - done, pending.size());
                    token.cancel();
                    break;
                }
                done++;

                double fraction = DISCOVERY_SHARE + (1 - DISCOVERY_SHARE) * done / pending.size();
                CanonicalBusiness business = businesses.get(submitted.get(next));
                Resolved resolved = result(next, business);
                if (resolved == null) {
                    progress.onProgress(business.getName() + ": lookup failed", fraction);
                    continue;
                }
                CanonicalBusiness updated = withEmail(out.get(resolved.index()), resolved.result());
                out.set(resolved.index(), updated);
                if (resolved.result().isFound()) found++;

                progress.onProgress(message(updated), fraction);
            }
            log.info("LeadScoutService: emails found for {} of {} businesses", found, pending.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new JobCancelledException("Interrupted while resolving emails");
        } finally {
            pool.shutdownNow();
        }
        return out;
    }

    private static Resolved result(Future<Resolved> future, CanonicalBusiness business) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof JobCancelledException) {
                log.info("LeadScoutService: lookup for '{}' cancelled: {}", business.getName(), cause.getMessage());
            } else {
                log.warn("LeadScoutService: lookup for '{}' failed: {}", business.getName(),
                        cause == null ? e.getMessage() : cause.getMessage());
            }
            return null;
        }
    }

    static CanonicalBusiness withEmail(CanonicalBusiness business, EmailResult result) {
        CanonicalBusiness.CanonicalBusinessBuilder b = business.toBuilder().emailResult(result);
        if (result.isFound()) b.email(result.getEmail());
        if ((business.getWebsite() == null || business.getWebsite().isBlank()) && result.getDiscoveredWebsite() != null) {
            b.website(result.getDiscoveredWebsite());
        }
        return b.build();
    }

    private static String message(CanonicalBusiness business) {
        EmailResult r = business.getEmailResult();
        if (r == null || !r.isFound()) return business.getName() + ": no email";
        return business.getName() + ": " + r.getEmail() + " (" + r.getSource() + ", " + r.getConfidence() + ")";
    }

    static ProgressListener scaled(ProgressListener target, double from, double to) {
        return (message, fraction) -> target.onProgress(message, from + (to - from) * Math.max(0, Math.min(1, fraction)));
    }

    private record Resolved(int index, EmailResult result) {
    }
}
