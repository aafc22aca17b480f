package de.htwsaar.urlmap.mapping.cache;

import java.time.Duration;

/**
 * Generischer Key-Value-Cache mit Ablaufzeit (In-Process oder externer Cache-Tier).
 * Implementierungen müssen für nebenläufige Nutzung sicher sein.
 */
public interface KeyValueCache {

    /**
     * Lesender Zugriff ohne Schreibeffekt.
     *
     * @param key Cache-Schlüssel
     * @return frischer Wert oder {@code null}
     */
    String get(String key);

    /**
     * Schreibt einen Wert und überschreibt einen vorhandenen.
     *
     * @param key   Cache-Schlüssel
     * @param value serialisierter Wert
     * @param ttl   Lebensdauer
     */
    void set(String key, String value, Duration ttl);

    /**
     * @param key Cache-Schlüssel
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    boolean delete(String key);
}
