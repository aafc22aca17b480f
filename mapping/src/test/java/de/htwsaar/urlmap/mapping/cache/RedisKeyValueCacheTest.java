package de.htwsaar.urlmap.mapping.cache;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

class RedisKeyValueCacheTest {

    private JedisPool pool;
    private Jedis jedis;
    private RedisKeyValueCache cache;

    @BeforeEach
    void setUp() {
        pool = mock(JedisPool.class);
        jedis = mock(Jedis.class);
        when(pool.getResource()).thenReturn(jedis);
        cache = new RedisKeyValueCache(pool);
    }

    @Test
    void getShouldReadAndReturnConnection() {
        when(jedis.get("urlmap:abc")).thenReturn("{\"id\":1}");

        assertEquals("{\"id\":1}", cache.get("urlmap:abc"));
        verify(jedis).close();
    }

    @Test
    void setShouldUseSetexWithTtlInSeconds() {
        cache.set("urlmap:abc", "v", Duration.ofMinutes(2));

        verify(jedis).setex("urlmap:abc", 120L, "v");
    }

    @Test
    void subSecondTtlShouldBeRoundedUpToOneSecond() {
        cache.set("k", "v", Duration.ofMillis(200));

        verify(jedis).setex("k", 1L, "v");
    }

    @Test
    void deleteShouldReportRemoval() {
        when(jedis.del("k")).thenReturn(1L);
        when(jedis.del("missing")).thenReturn(0L);

        assertTrue(cache.delete("k"));
        assertFalse(cache.delete("missing"));
    }

    @Test
    void nullKeysShouldNotTouchRedis() {
        assertNull(cache.get(null));
        cache.set(null, "v", Duration.ofSeconds(1));

        verifyNoInteractions(pool);
    }
}
