package de.htwsaar.urlmap.router.view;

import de.htwsaar.urlmap.mapping.content.ContentRequest;
import de.htwsaar.urlmap.mapping.content.ContentResponse;
import de.htwsaar.urlmap.mapping.content.ContentView;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Klassenbasierte View: liefert eine statische Datei aus {@code templates/} im Classpath.
 *
 * <p>initkwargs: {@code template_name} (Pflicht), {@code content_type} (optional).
 * Der Inhalt wird unverändert ausgeliefert.</p>
 */
public class StaticTemplateView implements ContentView {

    public static final String KEY = "static-template";
    public static final String TEMPLATE_NAME = "template_name";
    public static final String CONTENT_TYPE = "content_type";

    private static final String TEMPLATE_ROOT = "templates/";
    private static final String DEFAULT_CONTENT_TYPE = "text/html;charset=UTF-8";

    private final String templateName;
    private final String contentType;

    public StaticTemplateView(Map<String, Object> initkwargs) {
        Object name = initkwargs.get(TEMPLATE_NAME);
        if (!(name instanceof String s) || s.isBlank()) {
            throw new ContentRenderException("static-template requires initkwarg '" + TEMPLATE_NAME + "'");
        }
        if (s.contains("..") || s.startsWith("/")) {
            throw new ContentRenderException("Invalid template name: " + s);
        }
        this.templateName = s.trim();
        Object ct = initkwargs.get(CONTENT_TYPE);
        this.contentType = ct instanceof String c && !c.isBlank() ? c : DEFAULT_CONTENT_TYPE;
    }

    @Override
    public ContentResponse render(ContentRequest request, Map<String, Object> options) {
        String resource = TEMPLATE_ROOT + templateName;
        try (InputStream in = StaticTemplateView.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ContentRenderException("Template not found: " + resource);
            }
            return new ContentResponse(200, contentType, in.readAllBytes());
        } catch (IOException e) {
            throw new ContentRenderException("Cannot read template " + resource, e);
        }
    }
}
