package com.mike.leadscout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ConcurrencyConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService leadSourceExecutor(DiscoveryProperties props) {
        return Executors.newFixedThreadPool(Math.max(2, props.workers()), named("lead-source"));
    }

    /**
     * Runs single external calls so the caller can bound them with a timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService externalCallExecutor() {
        return Executors.newCachedThreadPool(named("external-call"));
    }

    public static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
