package de.htwsaar.urlmap.router.view;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.urlmap.mapping.content.ContentRequest;
import de.htwsaar.urlmap.mapping.content.ContentResponse;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TextViewTest {

    private final TextView view = new TextView();
    private final ContentRequest request = new ContentRequest("example.com", "/robots.txt", "/robots.txt", Map.of());

    @Test
    void shouldRenderBodyWithContentType() {
        ContentResponse response =
                view.render(request, Map.of(TextView.BODY, "User-agent: *", TextView.CONTENT_TYPE, "text/x-robots"));

        assertEquals(200, response.statusCode());
        assertEquals("text/x-robots", response.contentType());
        assertEquals("User-agent: *", response.bodyAsString());
    }

    @Test
    void missingOptionsShouldFallBackToEmptyPlainText() {
        ContentResponse response = view.render(request, Map.of());

        assertEquals("text/plain;charset=UTF-8", response.contentType());
        assertEquals(0, response.body().length);
    }
}
