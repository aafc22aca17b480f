package de.htwsaar.urlmap.mapping.cache;

import de.htwsaar.urlmap.common.serialization.JsonCodec;
import de.htwsaar.urlmap.common.serialization.UrlMapSerializationException;
import de.htwsaar.urlmap.common.util.Digests;
import de.htwsaar.urlmap.mapping.model.MappingRecord;
import de.htwsaar.urlmap.mapping.store.MappingStore;
import de.htwsaar.urlmap.mapping.store.MappingWriteListener;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-Through/Write-Through-Cache vor dem {@link MappingStore}.
 *
 * <p>Pro Lookup höchstens ein Store-Zugriff und ein Cache-Schreibzugriff. Nicht gefundene
 * Zuordnungen werden nie gecacht. Als {@link MappingWriteListener} überschreibt der Cache
 * nach jedem Speichern den Eintrag des Digests und entfernt bei Umbenennung den alten.</p>
 */
public class MappingCache implements MappingWriteListener {

    private static final Logger log = LoggerFactory.getLogger(MappingCache.class);

    private final MappingStore store;
    private final KeyValueCache cache;
    private final MappingCacheConfig config;

    public MappingCache(MappingStore store, KeyValueCache cache, MappingCacheConfig config) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Erstellt den Cache und registriert ihn als Listener am Store.
     *
     * @return verbundener Cache
     */
    public static MappingCache attach(MappingStore store, KeyValueCache cache, MappingCacheConfig config) {
        MappingCache mappingCache = new MappingCache(store, cache, config);
        store.addListener(mappingCache);
        return mappingCache;
    }

    /**
     * Liefert die Zuordnung aus dem Cache oder lädt sie einmalig aus dem Store.
     *
     * @param site          Site-Domain
     * @param canonicalPath kanonischer Pfad
     * @return Zuordnung oder leer
     */
    public Optional<MappingRecord> get(String site, String canonicalPath) {
        String key = cacheKey(Digests.mappingDigest(site, canonicalPath));

        String cached = cache.get(key);
        if (cached != null) {
            MappingRecord hit = decode(key, cached);
            if (hit != null) {
                log.debug("Mapping cache HIT {}{}", site, canonicalPath);
                return Optional.of(hit);
            }
        }

        log.debug("Mapping cache MISS {}{}", site, canonicalPath);
        Optional<MappingRecord> stored = store.findByKey(site, canonicalPath);
        stored.ifPresent(record -> cache.set(key, JsonCodec.toJson(record), config.ttl()));
        return stored;
    }

    /**
     * Wie {@link #get}, aber mit Exception statt leerem Ergebnis.
     *
     * @throws MappingNotFoundException wenn weder Cache noch Store die Zuordnung kennen
     */
    public MappingRecord require(String site, String canonicalPath) {
        return get(site, canonicalPath).orElseThrow(() -> new MappingNotFoundException(site, canonicalPath));
    }

    /**
     * Schreibt eine Zuordnung unter ihrem Digest in den Cache.
     *
     * @param record gespeicherte Zuordnung
     */
    public void put(MappingRecord record) {
        String digest = record.digest() != null ? record.digest() : Digests.mappingDigest(record.site(), record.path());
        cache.set(cacheKey(digest), JsonCodec.toJson(record), config.ttl());
    }

    public boolean evict(String digest) {
        return digest != null && cache.delete(cacheKey(digest));
    }

    @Override
    public void onSaved(String previousDigest, MappingRecord saved) {
        put(saved);
        if (previousDigest != null && !previousDigest.equals(saved.digest())) {
            evict(previousDigest);
        }
    }

    @Override
    public void onDeleted(String digest) {
        evict(digest);
    }

    public String cacheKey(String digest) {
        return config.keyPrefix() + digest;
    }

    private MappingRecord decode(String key, String json) {
        try {
            return JsonCodec.fromJson(json, MappingRecord.class);
        } catch (UrlMapSerializationException e) {
            log.warn("Dropping unreadable cache entry {}", key, e);
            cache.delete(key);
            return null;
        }
    }
}
