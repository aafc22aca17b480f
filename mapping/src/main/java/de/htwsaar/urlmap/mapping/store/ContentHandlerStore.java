package de.htwsaar.urlmap.mapping.store;

import de.htwsaar.urlmap.mapping.content.HandlerReferenceException;
import de.htwsaar.urlmap.mapping.model.ContentHandler;
import java.util.Map;
import java.util.Optional;

/**
 * Ablage der Content-Handler, die von Zuordnungen referenziert werden.
 */
public interface ContentHandlerStore {

    Optional<ContentHandler> findById(long id);

    /**
     * Speichert einen Handler, nachdem seine View aufgelöst wurde.
     *
     * @param handler zu speichernder Handler
     * @return gespeicherter Handler mit ID
     * @throws HandlerReferenceException wenn die View nicht registriert ist
     */
    ContentHandler save(ContentHandler handler);

    default ContentHandler create(String view, Map<String, Object> options) {
        return save(ContentHandler.of(view, options));
    }
}
