package de.htwsaar.urlmap.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-Codec für Cache-Werte und Handler-Optionen.
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<LinkedHashMap<String, Object>> OPTIONS_TYPE = new TypeReference<>() {};

    private JsonCodec() {
        // Utility
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new UrlMapSerializationException("Failed to serialize object to JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new UrlMapSerializationException(
                    "Failed to deserialize JSON to [" + clazz.getSimpleName() + "]", e);
        }
    }

    /**
     * Liest ein JSON-Objekt als geordnete Map; {@code null} oder leer ergibt eine leere Map.
     *
     * @param json JSON-Objekt
     * @return veränderbare, geordnete Map
     */
    public static Map<String, Object> optionsFromJson(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return MAPPER.readValue(json, OPTIONS_TYPE);
        } catch (JsonProcessingException e) {
            throw new UrlMapSerializationException("Failed to deserialize options map", e);
        }
    }
}
