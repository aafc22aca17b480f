package de.htwsaar.urlmap.router.view;

import de.htwsaar.urlmap.mapping.content.ContentRequest;
import de.htwsaar.urlmap.mapping.content.ContentResponse;
import de.htwsaar.urlmap.mapping.content.ContentView;
import java.util.Map;

/**
 * View-Funktion: antwortet mit dem Text aus den Optionen {@code body} und {@code content_type}.
 */
public class TextView implements ContentView {

    public static final String KEY = "text";
    public static final String BODY = "body";
    public static final String CONTENT_TYPE = "content_type";

    private static final String DEFAULT_CONTENT_TYPE = "text/plain;charset=UTF-8";

    @Override
    public ContentResponse render(ContentRequest request, Map<String, Object> options) {
        Object body = options.get(BODY);
        Object ct = options.get(CONTENT_TYPE);
        return ContentResponse.ok(
                ct instanceof String c && !c.isBlank() ? c : DEFAULT_CONTENT_TYPE,
                body == null ? "" : String.valueOf(body));
    }
}
