package com.mike.leadscout;

import com.mike.leadscout.config.BrowserProperties;
import com.mike.leadscout.config.CacheProperties;
import com.mike.leadscout.config.CascadeProperties;
import com.mike.leadscout.config.DiscoveryProperties;
import com.mike.leadscout.config.EmailProperties;
import com.mike.leadscout.config.ProviderProperties;
import com.mike.leadscout.config.ResilienceProperties;
import com.mike.leadscout.config.RunnerProperties;
import com.mike.leadscout.config.SerpApiProperties;
import com.mike.leadscout.config.YelpProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties({
        ResilienceProperties.class,
        DiscoveryProperties.class,
        CascadeProperties.class,
        EmailProperties.class,
        BrowserProperties.class,
        CacheProperties.class,
        ProviderProperties.class,
        SerpApiProperties.class,
        YelpProperties.class,
        RunnerProperties.class
})
public class LeadscoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadscoutApplication.class, args);
    }
}
