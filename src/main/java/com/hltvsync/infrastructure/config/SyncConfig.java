package com.hltvsync.infrastructure.config;

import com.hltvsync.infrastructure.session.BlockedPageClassifier;
import com.hltvsync.infrastructure.session.PageFetcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
public class SyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    /**
     * Source for fingerprints and pacing jitter.
     */
    @Bean
    public Random random() {
        return new SecureRandom();
    }

    @Bean
    public BlockedPageClassifier blockedPageClassifier(ScraperProperties properties) {
        return BlockedPageClassifier.fromProperties(properties.getClassifier());
    }

    @Bean(name = "pageRetryTemplate")
    public RetryTemplate pageRetryTemplate(ScraperProperties properties, Sleeper sleeper) {
        return PageFetcher.retryTemplate(properties.getRetry(), sleeper);
    }
}
