package de.htwsaar.urlmap.mapping.content;

import java.nio.charset.StandardCharsets;

/**
 * Ergebnis einer Content-View, ohne HTTP-Framework-Typen.
 *
 * @param statusCode  HTTP-Status
 * @param contentType MIME-Type (optional)
 * @param body        Inhalt, nie {@code null}
 */
public record ContentResponse(int statusCode, String contentType, byte[] body) {

    public ContentResponse {
        body = body == null ? new byte[0] : body;
    }

    public static ContentResponse ok(String contentType, String body) {
        return new ContentResponse(200, contentType, body.getBytes(StandardCharsets.UTF_8));
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
