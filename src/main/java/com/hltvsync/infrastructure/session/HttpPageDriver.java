package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.exception.TransientFetchException;
import com.hltvsync.infrastructure.config.ScraperProperties;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.cookie.BasicCookieStore;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Plain HTTP sessions for pages that render without scripts. Each session keeps its own
 * cookie store and presents its profile's headers.
 */
@Component
public class HttpPageDriver implements PageDriver {

    private static final Logger logger = LoggerFactory.getLogger(HttpPageDriver.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private final Timeout timeout;

    public HttpPageDriver(ScraperProperties properties) {
        this.timeout = Timeout.ofMilliseconds(properties.getSession().getNavigationTimeout().toMillis());
    }

    @Override
    public Renderer renderer() {
        return Renderer.HTTP;
    }

    @Override
    public DriverSession open(FingerprintProfile profile) {
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(timeout)
            .setResponseTimeout(timeout)
            .build();
        CloseableHttpClient client = HttpClients.custom()
            .setDefaultCookieStore(new BasicCookieStore())
            .setDefaultRequestConfig(requestConfig)
            .build();
        return new HttpSession(client, profile);
    }

    /**
     * Reads the response body, as UTF-8 unless the response names another charset.
     */
    static String readBody(HttpEntity entity) throws IOException, ParseException {
        return entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
    }

    private static void logResponseBodyPreview(String url, String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.debug("Response body preview for {}: {}", url, preview);
    }

    private static final class HttpSession implements DriverSession {

        private final CloseableHttpClient client;
        private final FingerprintProfile profile;

        HttpSession(CloseableHttpClient client, FingerprintProfile profile) {
            this.client = client;
            this.profile = profile;
        }

        @Override
        public RawPage navigate(String url, PageSpec spec) throws TransientFetchException {
            HttpGet request = new HttpGet(url);
            profile.headers().forEach(request::addHeader);
            HttpClientContext context = HttpClientContext.create();

            try (CloseableHttpResponse response = client.execute(request, context)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String body;
                try {
                    body = readBody(entity);
                } catch (ParseException e) {
                    throw new TransientFetchException("Failed to read response body", url, e);
                }
                if (statusCode >= 400) {
                    logger.warn("HTTP request to {} failed with status {}", url, statusCode);
                    logResponseBodyPreview(url, body);
                }
                boolean ready = spec.readySelector() == null || spec.readySelector().isBlank()
                    || Jsoup.parse(body, url).selectFirst(spec.readySelector()) != null;
                return new RawPage(statusCode, finalUrl(url, context), body, ready);
            } catch (IOException e) {
                throw new TransientFetchException("HTTP request failed: " + e.getMessage(), url, e);
            }
        }

        private static String finalUrl(String url, HttpClientContext context) {
            if (context.getRedirectLocations() == null) {
                return url;
            }
            List<URI> locations = context.getRedirectLocations().getAll();
            return locations.isEmpty() ? url : locations.get(locations.size() - 1).toString();
        }

        @Override
        public void close() {
            try {
                client.close();
            } catch (IOException e) {
                logger.warn("Failed to close HTTP session: {}", e.getMessage());
            }
        }
    }
}
