package de.htwsaar.urlmap.mapping.content;

import java.util.Map;

/**
 * Erzeugt klassenbasierte Views aus ihren {@code initkwargs}.
 */
@FunctionalInterface
public interface ContentViewFactory {

    ContentView create(Map<String, Object> initkwargs);
}
