package de.htwsaar.urlmap.mapping.content;

import de.htwsaar.urlmap.mapping.model.ContentHandler;
import java.util.Objects;

/**
 * Eintrag der {@link HandlerRegistry}.
 *
 * @param key     stabiler Registry-Schlüssel
 * @param kind    Aufrufform
 * @param factory liefert die View; bei {@link ViewKind#FUNCTION} immer dieselbe Instanz
 */
public record RegisteredView(String key, ViewKind kind, ContentViewFactory factory) {

    public RegisteredView {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * Ruft die View für einen Handler auf.
     *
     * @param handler Handler mit Optionen
     * @param request Request-Kontext
     * @return Antwort der View
     */
    public ContentResponse invoke(ContentHandler handler, ContentRequest request) {
        return switch (kind) {
            case CLASS -> factory.create(handler.initkwargs()).render(request, handler.callOptions());
            case FUNCTION -> factory.create(handler.initkwargs()).render(request, handler.options());
        };
    }
}
