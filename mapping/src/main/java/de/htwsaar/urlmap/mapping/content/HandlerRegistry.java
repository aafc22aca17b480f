package de.htwsaar.urlmap.mapping.content;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry von Content-Views unter stabilen Schlüsseln, befüllt beim Start der Anwendung.
 */
public final class HandlerRegistry {

    private final Map<String, RegisteredView> views = new ConcurrentHashMap<>();

    /**
     * Registriert eine klassenbasierte View.
     *
     * @param key     Registry-Schlüssel
     * @param factory erzeugt die View aus den {@code initkwargs}
     * @return diese Registry
     */
    public HandlerRegistry registerClass(String key, ContentViewFactory factory) {
        return register(new RegisteredView(requireKey(key), ViewKind.CLASS, factory));
    }

    /**
     * Registriert eine View-Funktion.
     *
     * @param key  Registry-Schlüssel
     * @param view View-Funktion
     * @return diese Registry
     */
    public HandlerRegistry registerFunction(String key, ContentView view) {
        Objects.requireNonNull(view, "view must not be null");
        return register(new RegisteredView(requireKey(key), ViewKind.FUNCTION, ignored -> view));
    }

    /**
     * @param key Registry-Schlüssel
     * @return registrierte View
     * @throws HandlerReferenceException wenn nichts unter dem Schlüssel registriert ist
     */
    public RegisteredView require(String key) {
        RegisteredView view = key == null ? null : views.get(key);
        if (view == null) throw new HandlerReferenceException(key);
        return view;
    }

    private HandlerRegistry register(RegisteredView view) {
        views.put(view.key(), view);
        return this;
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("view key must not be blank");
        return key.trim();
    }
}
