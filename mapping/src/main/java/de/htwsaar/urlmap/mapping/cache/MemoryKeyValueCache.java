package de.htwsaar.urlmap.mapping.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-Process {@link KeyValueCache} für einen einzelnen Router-Prozess.
 *
 * <p>Hält serialisierte Zuordnungen in Zugriffsreihenfolge. Abgelaufene Einträge werden beim
 * Lesen entfernt; bei Überlauf zuerst alle abgelaufenen, dann die am längsten nicht gelesenen.
 * Thread-Safety: {@code synchronized}.</p>
 */
public class MemoryKeyValueCache implements KeyValueCache {

    private record Entry(String json, long expiresAtMs) {
        boolean expired(long nowMs) {
            return expiresAtMs <= nowMs;
        }
    }

    private final int maxEntries;
    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>(64, 0.75f, true);

    /**
     * @param maxEntries maximale Anzahl Zuordnungen (0 = unbegrenzt)
     * @param clock      Uhr für Ablaufzeiten
     */
    public MemoryKeyValueCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(0, maxEntries);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized String get(String key) {
        if (key == null) return null;
        Entry e = entries.get(key);
        if (e == null) return null;
        if (e.expired(clock.millis())) {
            entries.remove(key);
            return null;
        }
        return e.json();
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        if (key == null || value == null) return;
        long now = clock.millis();
        long ttlMs = ttl != null ? Math.max(0, ttl.toMillis()) : 0;
        entries.put(key, new Entry(value, now + ttlMs));
        if (maxEntries == 0 || entries.size() <= maxEntries) return;

        entries.values().removeIf(e -> e.expired(now));
        Iterator<String> eldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }
    }

    @Override
    public synchronized boolean delete(String key) {
        return key != null && entries.remove(key) != null;
    }

    synchronized int size() {
        return entries.size();
    }
}
