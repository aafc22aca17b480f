package de.htwsaar.urlmap.mapping.content;

import de.htwsaar.urlmap.mapping.model.ContentHandler;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Löst die View eines Handlers in der {@link HandlerRegistry} auf und ruft sie auf.
 */
public class ContentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ContentDispatcher.class);

    private final HandlerRegistry registry;

    public ContentDispatcher(HandlerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * @param handler aufzulösender Handler
     * @param request Request-Kontext
     * @return Antwort der View
     * @throws HandlerReferenceException wenn die View inzwischen nicht mehr registriert ist
     */
    public ContentResponse dispatch(ContentHandler handler, ContentRequest request) {
        Objects.requireNonNull(handler, "handler must not be null");
        RegisteredView view = registry.require(handler.view());
        log.debug("Dispatching {} to view '{}' ({})", request.canonicalPath(), view.key(), view.kind());
        return view.invoke(handler, request);
    }
}
