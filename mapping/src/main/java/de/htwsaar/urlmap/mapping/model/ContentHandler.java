package de.htwsaar.urlmap.mapping.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verweis auf registrierte Content-Logik inklusive freier Optionen.
 *
 * <p>Der Schlüssel {@value #INIT_KWARGS} enthält die Konstruktor-Optionen klassenbasierter Views,
 * alle übrigen Einträge werden beim Aufruf übergeben.</p>
 *
 * @param id      vom Store vergebene ID ({@code null} vor dem ersten Speichern)
 * @param view    Registry-Schlüssel der View
 * @param options geordnete Optionen mit JSON-kompatiblen Werten
 */
public record ContentHandler(Long id, String view, Map<String, Object> options) {

    public static final String INIT_KWARGS = "initkwargs";

    public ContentHandler {
        Objects.requireNonNull(view, "view must not be null");
        options = options == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ContentHandler of(String view, Map<String, Object> options) {
        return new ContentHandler(null, view, options);
    }

    public ContentHandler withId(Long newId) {
        return new ContentHandler(newId, view, options);
    }

    /**
     * Konstruktor-Optionen für klassenbasierte Views.
     *
     * @return Inhalt von {@value #INIT_KWARGS} oder eine leere Map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> initkwargs() {
        Object raw = options.get(INIT_KWARGS);
        if (raw instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap((Map<String, Object>) map);
        }
        return Collections.emptyMap();
    }

    /**
     * Aufruf-Optionen ohne {@value #INIT_KWARGS}.
     *
     * @return geordnete Kopie der übrigen Optionen
     */
    public Map<String, Object> callOptions() {
        Map<String, Object> rest = new LinkedHashMap<>(options);
        rest.remove(INIT_KWARGS);
        return Collections.unmodifiableMap(rest);
    }
}
