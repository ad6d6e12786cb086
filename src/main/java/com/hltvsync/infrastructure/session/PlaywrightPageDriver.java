package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.exception.TransientFetchException;
import com.hltvsync.infrastructure.config.ScraperProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.ViewportSize;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Headless Chromium sessions. Each session owns its own Playwright instance, so a session is
 * confined to whichever worker holds it.
 */
@Component
public class PlaywrightPageDriver implements PageDriver {

    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPageDriver.class);

    private static final List<String> BROWSER_ARGS = List.of(
        "--disable-blink-features=AutomationControlled",
        "--disable-dev-shm-usage",
        "--no-sandbox",
        "--disable-gpu",
        "--disable-extensions");

    private final boolean headless;
    private final Duration navigationTimeout;

    public PlaywrightPageDriver(ScraperProperties properties) {
        this.headless = properties.getSession().isHeadless();
        this.navigationTimeout = properties.getSession().getNavigationTimeout();
    }

    @Override
    public Renderer renderer() {
        return Renderer.BROWSER;
    }

    @Override
    public DriverSession open(FingerprintProfile profile) throws TransientFetchException {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setArgs(BROWSER_ARGS));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(profile.userAgent())
                .setViewportSize(new ViewportSize(profile.viewportWidth(), profile.viewportHeight()))
                .setLocale(profile.locale())
                .setTimezoneId(profile.timezoneId())
                .setExtraHTTPHeaders(profile.headers()));
            context.addInitScript(profile.stealthScript());
            Page page = context.newPage();
            return new BrowserSession(playwright, page);
        } catch (PlaywrightException e) {
            if (playwright != null) {
                playwright.close();
            }
            throw new TransientFetchException("Failed to start browser session: " + e.getMessage(), null, e);
        }
    }

    private class BrowserSession implements DriverSession {

        private final Playwright playwright;
        private final Page page;

        BrowserSession(Playwright playwright, Page page) {
            this.playwright = playwright;
            this.page = page;
        }

        @Override
        public RawPage navigate(String url, PageSpec spec) throws TransientFetchException {
            Response response;
            try {
                response = page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(navigationTimeout.toMillis())
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            } catch (PlaywrightException e) {
                throw new TransientFetchException("Navigation failed: " + e.getMessage(), url, e);
            }

            boolean ready = true;
            if (spec.readySelector() != null && !spec.readySelector().isBlank()) {
                try {
                    page.waitForSelector(spec.readySelector(),
                        new Page.WaitForSelectorOptions().setTimeout(spec.readyTimeout().toMillis()));
                } catch (TimeoutError e) {
                    logger.debug("Ready selector '{}' not found on {}", spec.readySelector(), url);
                    ready = false;
                }
            }

            try {
                int status = response == null ? 200 : response.status();
                return new RawPage(status, page.url(), page.content(), ready);
            } catch (PlaywrightException e) {
                throw new TransientFetchException("Failed to read page content: " + e.getMessage(), url, e);
            }
        }

        @Override
        public void close() {
            playwright.close();
        }
    }
}
