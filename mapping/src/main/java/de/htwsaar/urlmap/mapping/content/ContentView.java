package de.htwsaar.urlmap.mapping.content;

import java.util.Map;

/**
 * Ausführbare Content-Logik.
 */
@FunctionalInterface
public interface ContentView {

    ContentResponse render(ContentRequest request, Map<String, Object> options);
}
