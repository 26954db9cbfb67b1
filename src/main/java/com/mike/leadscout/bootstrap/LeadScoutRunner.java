package com.mike.leadscout.bootstrap;

import com.mike.leadscout.config.RunnerProperties;
import com.mike.leadscout.email.EmailResult;
import com.mike.leadscout.quality.CanonicalBusiness;
import com.mike.leadscout.service.LeadScoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Runs one enrichment job at startup from {@code leadscout.runner.*}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "leadscout.runner", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class LeadScoutRunner implements CommandLineRunner {

    private final LeadScoutService leadScoutService;
    private final RunnerProperties props;

    @Override
    public void run(String... args) {
        if (props.query() == null || props.query().isBlank()) {
            log.warn("LeadScoutRunner: leadscout.runner.query is empty, nothing to do");
            return;
        }

        int count = props.count() > 0 ? props.count() : 20;
        LocalDateTime start = LocalDateTime.now();
        log.info("LeadScoutRunner: started at {} query='{}', location='{}', count={}",
                start, props.query(), props.location(), count);

        List<CanonicalBusiness> businesses;
        try {
            businesses = leadScoutService.enrich(props.query(), props.location(), count,
                    (message, fraction) -> log.info("LeadScoutRunner: [{}%] {}", Math.round(fraction * 100), message));
        } catch (RuntimeException e) {
            log.warn("LeadScoutRunner: job failed: {}", e.getMessage(), e);
            return;
        }

        int withEmail = 0;
        for (CanonicalBusiness b : businesses) {
            EmailResult r = b.getEmailResult();
            if (r != null && r.isFound()) withEmail++;
            log.info("  - {} | {} | {} | sources={} | score={} | email={}",
                    b.getName(), b.getPhone(), b.effectiveWebsite(), b.getSources(),
                    b.getQuality() == null ? null : b.getQuality().getOverallScore(),
                    r == null || !r.isFound() ? "-" : r.getEmail() + " (" + r.getSource() + ", " + r.getConfidence() + ")");
        }
        log.info("LeadScoutRunner: finished at {}, businesses={}, withEmail={}",
                LocalDateTime.now(), businesses.size(), withEmail);
    }
}
