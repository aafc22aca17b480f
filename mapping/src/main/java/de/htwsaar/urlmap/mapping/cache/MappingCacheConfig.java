package de.htwsaar.urlmap.mapping.cache;

import java.time.Duration;

/**
 * Einstellungen des {@link MappingCache}, beim Start aus den Properties gelesen.
 *
 * @param ttlMs     Lebensdauer gecachter Zuordnungen in ms
 * @param keyPrefix Präfix vor dem Digest im Cache-Schlüssel
 */
public record MappingCacheConfig(long ttlMs, String keyPrefix) {

    public static final long DEFAULT_TTL_MS = 3_600_000L;
    public static final String DEFAULT_KEY_PREFIX = "urlmap:";

    public MappingCacheConfig {
        ttlMs = Math.max(0, ttlMs);
        keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    public static MappingCacheConfig defaults() {
        return new MappingCacheConfig(DEFAULT_TTL_MS, DEFAULT_KEY_PREFIX);
    }

    public Duration ttl() {
        return Duration.ofMillis(ttlMs);
    }
}
