package com.hltvsync.infrastructure.session;

import java.time.Duration;

/**
 * Fetch settings of one page kind. {@code {id}} in the url template is replaced by the
 * external id.
 */
public record PageSpec(String urlTemplate, String readySelector, Renderer renderer, Duration readyTimeout) {

    public String urlFor(Long externalId) {
        if (urlTemplate.contains("{id}")) {
            if (externalId == null) {
                throw new IllegalArgumentException("Url template needs an id: " + urlTemplate);
            }
            return urlTemplate.replace("{id}", String.valueOf(externalId));
        }
        return urlTemplate;
    }
}
