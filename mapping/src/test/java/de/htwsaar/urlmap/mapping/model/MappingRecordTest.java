package de.htwsaar.urlmap.mapping.model;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.urlmap.common.serialization.JsonCodec;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MappingRecordTest {

    private final MappingRecord url = MappingRecord.of("example.com", "/test_path", 200);

    @Test
    void protocolShouldFollowForceSecure() {
        assertEquals("http", url.protocol());
        assertEquals("https", url.withForceSecure(true).protocol());
    }

    @Test
    void absoluteUrlShouldCombineProtocolSiteAndPath() {
        assertEquals("http://example.com/test_path", url.absoluteUrl());
        assertEquals("https://example.com/test_path", url.withForceSecure(true).absoluteUrl());
    }

    @Test
    void statusCodesShouldClassify() {
        assertTrue(StatusCodes.isRedirect(301));
        assertTrue(StatusCodes.isRedirect(302));
        assertFalse(StatusCodes.isRedirect(307));
        assertTrue(StatusCodes.isContent(204));
        assertFalse(StatusCodes.isContent(410));
    }

    @Test
    void cachedJsonShouldKeepTargetAndHandler() {
        MappingRecord target = new MappingRecord(1L, "example.com", "/target", 204, null, null, true, "d1");
        ContentHandler handler = new ContentHandler(
                7L, "template", Map.of(ContentHandler.INIT_KWARGS, Map.of("template_name", "a.html")));
        MappingRecord source = new MappingRecord(2L, "example.com", "/source", 301, target, handler, false, "d2");

        MappingRecord decoded = JsonCodec.fromJson(JsonCodec.toJson(source), MappingRecord.class);

        assertEquals(source, decoded);
        assertEquals("https://example.com/target", decoded.redirect().absoluteUrl());
        assertEquals("a.html", decoded.contentHandler().initkwargs().get("template_name"));
    }
}
