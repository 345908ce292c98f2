package org.artsrv.index.edge;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EdgeResponseTest {

    private final Locale saved = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(saved);
    }

    @Test
    void headerLookupIgnoresCaseRegardlessOfDefaultLocale() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        EdgeResponse response = new EdgeResponse("200", "OK",
                Map.of("x-request-id", List.of(new EdgeHeader("X-Request-Id", "abc"))), "");

        assertEquals("abc", response.header("X-REQUEST-ID"));
        assertEquals("text/html", EdgeResponse.html("").header("CONTENT-TYPE"));
    }

    @Test
    void missingHeaderIsNull() {
        assertNull(EdgeResponse.badGateway().header("Location"));
        assertEquals("502", EdgeResponse.badGateway().status());
    }
}
