package de.htwsaar.urlmap.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonCodecTest {

    record Sample(String site, int statusCode) {}

    @Test
    void shouldWriteRecordFields() {
        String json = JsonCodec.toJson(new Sample("example.com", 410));

        assertTrue(json.contains("\"site\":\"example.com\""));
        assertTrue(json.contains("\"statusCode\":410"));
    }

    @Test
    void shouldIgnoreUnknownProperties() {
        Sample s = JsonCodec.fromJson("{\"site\":\"a\",\"statusCode\":204,\"extra\":true}", Sample.class);

        assertEquals(new Sample("a", 204), s);
    }

    @Test
    void shouldKeepOptionOrderAndNesting() {
        Map<String, Object> options = JsonCodec.optionsFromJson(
                "{\"initkwargs\":{\"template_name\":\"base.html\"},\"b\":1,\"a\":[1,2]}");

        assertEquals(List.of("initkwargs", "b", "a"), List.copyOf(options.keySet()));
        assertEquals(Map.of("template_name", "base.html"), options.get("initkwargs"));
    }

    @Test
    void blankOptionsShouldYieldEmptyMap() {
        assertTrue(JsonCodec.optionsFromJson(null).isEmpty());
        assertTrue(JsonCodec.optionsFromJson(" ").isEmpty());
    }

    @Test
    void invalidJsonShouldThrow() {
        assertThrows(UrlMapSerializationException.class, () -> JsonCodec.fromJson("{site: kaputt}", Sample.class));
        assertThrows(UrlMapSerializationException.class, () -> JsonCodec.optionsFromJson("[1,2]"));
    }
}
