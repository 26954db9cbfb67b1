package com.mike.leadscout.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.leadscout.config.EmailProperties;
import com.mike.leadscout.config.ResilienceProperties;
import com.mike.leadscout.email.extract.CloudflareCfEmailExtractor;
import com.mike.leadscout.email.extract.EmailCanonicalizer;
import com.mike.leadscout.email.extract.EmailHarvester;
import com.mike.leadscout.email.extract.EmailNormalizer;
import com.mike.leadscout.email.extract.EmailValidator;
import com.mike.leadscout.email.extract.FooterHeaderExtractor;
import com.mike.leadscout.email.extract.FormFieldExtractor;
import com.mike.leadscout.email.extract.FrameExtractor;
import com.mike.leadscout.email.extract.MailToExtractor;
import com.mike.leadscout.email.extract.MetaAttributeExtractor;
import com.mike.leadscout.email.extract.RegexTextExtractor;
import com.mike.leadscout.email.extract.RenderedTextExtractor;
import com.mike.leadscout.email.extract.StructuredDataExtractor;
import com.mike.leadscout.email.extract.TextObfuscationNormalizer;

import java.time.Duration;
import java.util.List;
import java.util.Set;

public final class TestProperties {

    private TestProperties() {
    }

    /**
     * Default breaker settings, 10 ms retry delays.
     */
    public static ResilienceProperties fastResilience(int maxRetries) {
        return new ResilienceProperties(
                new ResilienceProperties.Retry(maxRetries, Duration.ofMillis(10), Duration.ofMillis(20), 2.0, 0.0),
                new ResilienceProperties.Breaker(5, Duration.ofSeconds(60), 2),
                Duration.ofSeconds(5),
                1);
    }

    public static EmailProperties email() {
        return email(true, EmailProperties.MxUnknownPolicy.WARN);
    }

    public static EmailProperties email(boolean mxCheckEnabled, EmailProperties.MxUnknownPolicy unknownPolicy) {
        return new EmailProperties(
                mxCheckEnabled,
                unknownPolicy,
                3000,
                new EmailProperties.Smtp(false, Duration.ofSeconds(5), "localhost", "probe@localhost"),
                Set.of("com", "net", "org", "co", "io", "us"));
    }

    /**
     * Harvester wired with every extractor, as the application context builds it.
     */
    public static EmailHarvester harvester() {
        TextObfuscationNormalizer obfuscation = new TextObfuscationNormalizer();
        MailToExtractor mailTo = new MailToExtractor(obfuscation);
        return new EmailHarvester(
                List.of(
                        new RegexTextExtractor(),
                        mailTo,
                        new CloudflareCfEmailExtractor(),
                        new StructuredDataExtractor(new ObjectMapper()),
                        new MetaAttributeExtractor(),
                        new FormFieldExtractor(),
                        new FooterHeaderExtractor(obfuscation),
                        new RenderedTextExtractor(obfuscation),
                        new FrameExtractor(mailTo)),
                new EmailCanonicalizer(new EmailNormalizer(), new EmailValidator(email())),
                obfuscation);
    }
}
