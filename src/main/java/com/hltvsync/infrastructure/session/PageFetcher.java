package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.exception.BlockedPageException;
import com.hltvsync.domain.exception.FetchException;
import com.hltvsync.domain.exception.TransientFetchException;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.ports.PageSource;
import com.hltvsync.infrastructure.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads pages through the session pool, retrying blocked and transient loads on a fresh
 * session each time.
 */
@Component
public class PageFetcher implements PageSource {

    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    private final SessionManager sessionManager;
    private final PageCatalog catalog;
    private final RetryTemplate retryTemplate;

    public PageFetcher(SessionManager sessionManager, PageCatalog catalog, RetryTemplate pageRetryTemplate) {
        this.sessionManager = sessionManager;
        this.catalog = catalog;
        this.retryTemplate = pageRetryTemplate;
    }

    /**
     * Retry template for page loads: exponential backoff with random jitter, capped, retrying
     * only {@link FetchException}s.
     */
    public static RetryTemplate retryTemplate(ScraperProperties.Retry settings, Sleeper sleeper) {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(Math.max(1, settings.getMaxAttempts()), Map.of(
            BlockedPageException.class, true,
            TransientFetchException.class, true
        ));
        ExponentialRandomBackOffPolicy backOffPolicy = new ExponentialRandomBackOffPolicy();
        backOffPolicy.setInitialInterval(settings.getInitialBackoff().toMillis());
        backOffPolicy.setMultiplier(settings.getMultiplier());
        backOffPolicy.setMaxInterval(settings.getMaxBackoff().toMillis());
        backOffPolicy.setSleeper(sleeper);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }

    @Override
    public PageContent fetch(PageKind pageKind, Long externalId) throws FetchException {
        String url = urlFor(pageKind, externalId);
        AtomicInteger attempts = new AtomicInteger();
        try {
            return retryTemplate.execute(context -> {
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    logger.info("Retrying {} (attempt {})", url, attempt);
                }
                return loadOnce(pageKind, url, externalId);
            });
        } catch (FetchException e) {
            e.setAttempts(attempts.get());
            logger.warn("Giving up on {} after {} attempts: {}", url, attempts.get(), e.getMessage());
            throw e;
        }
    }

    @Override
    public String urlFor(PageKind pageKind, Long externalId) {
        return catalog.urlFor(pageKind, externalId);
    }

    @Override
    public void shutdown() {
        sessionManager.shutdown();
    }

    private PageContent loadOnce(PageKind pageKind, String url, Long externalId) throws FetchException {
        Session session = sessionManager.acquire(pageKind);
        try {
            return sessionManager.load(session, url, externalId);
        } finally {
            sessionManager.release(session);
        }
    }
}
