package com.mike.leadscout.bootstrap;

import com.mike.leadscout.cache.CacheStats;
import com.mike.leadscout.cache.EmailCache;
import com.mike.leadscout.resilience.CircuitState;
import com.mike.leadscout.resilience.SourceCircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class CacheStatsReporter {

    private final EmailCache emailCache;
    private final SourceCircuitBreaker circuitBreaker;

    @Value("${leadscout.report.enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${leadscout.report.interval-millis:300000}",
            initialDelayString = "${leadscout.report.interval-millis:300000}")
    public void report() {
        if (!enabled) return;

        CacheStats stats = emailCache.stats();
        log.info("CacheStatsReporter: email cache hits={}, misses={}, errors={}, entries={}, hitRate={}",
                stats.hits(), stats.misses(), stats.errors(), stats.entries(),
                String.format("%.2f", stats.hitRate()));

        Map<String, CircuitState> circuits = circuitBreaker.statuses();
        long notClosed = circuits.values().stream().filter(s -> s != CircuitState.CLOSED).count();
        if (notClosed > 0) {
            log.warn("CacheStatsReporter: {} circuit(s) not closed: {}", notClosed, circuits);
        } else {
            log.info("CacheStatsReporter: {} circuit(s), all closed", circuits.size());
        }
    }
}
