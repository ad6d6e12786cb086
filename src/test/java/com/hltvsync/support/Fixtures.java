package com.hltvsync.support;

import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Loads saved HLTV pages from {@code src/test/resources/pages}.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String html(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/pages/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PageContent page(PageKind kind, Long subjectId, String url, String html, Instant fetchedAt) {
        return new PageContent(kind, subjectId, url, url, 200, html, fetchedAt);
    }
}
