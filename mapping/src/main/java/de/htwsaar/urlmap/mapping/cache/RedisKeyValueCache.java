package de.htwsaar.urlmap.mapping.cache;

import java.time.Duration;
import java.util.Objects;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

/**
 * {@link KeyValueCache} auf einem externen Redis-Tier.
 * Verbindungsfehler werden nicht abgefangen; Timeouts regelt der {@link JedisPool}.
 */
public class RedisKeyValueCache implements KeyValueCache {

    private final JedisPool pool;

    public RedisKeyValueCache(JedisPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    @Override
    public String get(String key) {
        if (key == null) return null;
        try (Jedis jedis = pool.getResource()) {
            return jedis.get(key);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (key == null || value == null) return;
        // Redis kennt keine TTL unter einer Sekunde über SETEX
        long seconds = ttl != null ? Math.max(1, ttl.toSeconds()) : 1;
        try (Jedis jedis = pool.getResource()) {
            jedis.setex(key, seconds, value);
        }
    }

    @Override
    public boolean delete(String key) {
        if (key == null) return false;
        try (Jedis jedis = pool.getResource()) {
            return jedis.del(key) > 0;
        }
    }
}
