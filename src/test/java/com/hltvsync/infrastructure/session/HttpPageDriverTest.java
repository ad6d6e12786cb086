package com.hltvsync.infrastructure.session;

import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpPageDriverTest {

    private static final String NAME = "<div class=\"playerRealname\">Nicolai Reedtz Dupréel Kølle</div>";

    @Test
    void testBodyWithoutCharsetIsReadAsUtf8() throws Exception {
        ByteArrayEntity entity = new ByteArrayEntity(NAME.getBytes(StandardCharsets.UTF_8),
            ContentType.create("text/html"));

        assertEquals(NAME, HttpPageDriver.readBody(entity));
    }

    @Test
    void testDeclaredCharsetWins() throws Exception {
        ByteArrayEntity entity = new ByteArrayEntity(NAME.getBytes(StandardCharsets.ISO_8859_1),
            ContentType.create("text/html", StandardCharsets.ISO_8859_1));

        assertEquals(NAME, HttpPageDriver.readBody(entity));
    }

    @Test
    void testMissingEntityIsEmpty() throws Exception {
        assertEquals("", HttpPageDriver.readBody(null));
    }
}
