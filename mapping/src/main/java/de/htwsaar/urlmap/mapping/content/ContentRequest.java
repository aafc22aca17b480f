package de.htwsaar.urlmap.mapping.content;

import java.util.List;
import java.util.Map;

/**
 * Transport-agnostischer Request-Kontext für Content-Views.
 *
 * @param site          Site-Domain
 * @param path          roher Request-Pfad
 * @param canonicalPath kanonischer Pfad
 * @param parameters    Query-Parameter
 */
public record ContentRequest(String site, String path, String canonicalPath, Map<String, List<String>> parameters) {

    public ContentRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
