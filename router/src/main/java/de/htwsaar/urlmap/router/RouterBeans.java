package de.htwsaar.urlmap.router;

import de.htwsaar.urlmap.mapping.cache.KeyValueCache;
import de.htwsaar.urlmap.mapping.cache.MappingCache;
import de.htwsaar.urlmap.mapping.cache.MappingCacheConfig;
import de.htwsaar.urlmap.mapping.cache.MemoryKeyValueCache;
import de.htwsaar.urlmap.mapping.cache.RedisKeyValueCache;
import de.htwsaar.urlmap.mapping.content.ContentDispatcher;
import de.htwsaar.urlmap.mapping.content.HandlerRegistry;
import de.htwsaar.urlmap.mapping.resolve.Resolver;
import de.htwsaar.urlmap.mapping.store.ContentHandlerStore;
import de.htwsaar.urlmap.mapping.store.JooqContentHandlerStore;
import de.htwsaar.urlmap.mapping.store.JooqMappingStore;
import de.htwsaar.urlmap.mapping.store.MappingSchema;
import de.htwsaar.urlmap.mapping.store.MappingStore;
import de.htwsaar.urlmap.router.view.StaticTemplateView;
import de.htwsaar.urlmap.router.view.TextView;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;
import redis.clients.jedis.JedisPool;

/**
 * Zentrale Spring-Verdrahtung des Routers.
 *
 * <p>Schichtung: Controller → Resolver → MappingCache → Store/Key-Value-Cache</p>
 */
@Configuration
public class RouterBeans {

    private static final Logger log = LoggerFactory.getLogger(RouterBeans.class);

    /**
     * Systemuhr für TTL-Berechnungen.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * jOOQ-Kontext auf der SQLite-Datei; das Schema wird beim Start angelegt.
     *
     * <p>Die DataSource wird nicht als Bean registriert (keine JDBC-Autokonfiguration).</p>
     *
     * @param dbPath Pfad der SQLite-Datei (Standard: data/urlmap.db)
     * @return jOOQ-DSL
     */
    @Bean
    public DSLContext dslContext(@Value("${urlmap.db.path:data/urlmap.db}") String dbPath) {
        Path file = Path.of(dbPath).toAbsolutePath();
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create database directory for " + file, e);
        }
        SQLiteDataSource ds = new SQLiteDataSource();
        ds.setUrl("jdbc:sqlite:" + file);
        DSLContext dsl = DSL.using(ds, SQLDialect.SQLITE);
        MappingSchema.create(dsl);
        log.info("Mapping database ready at {}", file);
        return dsl;
    }

    /**
     * Registry mit den eingebauten Views.
     *
     * @return befüllte {@link HandlerRegistry}
     */
    @Bean
    public HandlerRegistry handlerRegistry() {
        return new HandlerRegistry()
                .registerClass(StaticTemplateView.KEY, StaticTemplateView::new)
                .registerFunction(TextView.KEY, new TextView());
    }

    @Bean
    public MappingStore mappingStore(DSLContext dsl) {
        return new JooqMappingStore(dsl);
    }

    @Bean
    public ContentHandlerStore contentHandlerStore(DSLContext dsl, HandlerRegistry handlerRegistry) {
        return new JooqContentHandlerStore(dsl, handlerRegistry);
    }

    /**
     * Cache-Einstellungen aus den Properties.
     *
     * @param ttlMs     TTL in ms (Standard: 3600000)
     * @param keyPrefix Präfix aller Cache-Schlüssel (Standard: "urlmap:")
     * @return {@link MappingCacheConfig}
     */
    @Bean
    public MappingCacheConfig mappingCacheConfig(
            @Value("${urlmap.cache.ttl-ms:3600000}") long ttlMs,
            @Value("${urlmap.cache.key-prefix:urlmap:}") String keyPrefix) {
        return new MappingCacheConfig(ttlMs, keyPrefix);
    }

    /**
     * Verbindungspool für das Redis-Tier, nur bei {@code urlmap.cache.backend=redis}.
     *
     * @param host Redis-Host
     * @param port Redis-Port
     * @return Jedis-Pool
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "urlmap.cache.backend", havingValue = "redis")
    public JedisPool jedisPool(
            @Value("${urlmap.cache.redis.host:localhost}") String host,
            @Value("${urlmap.cache.redis.port:6379}") int port) {
        return new JedisPool(host, port);
    }

    /**
     * Key-Value-Cache je nach Backend.
     *
     * @param backend    {@code memory} oder {@code redis}
     * @param maxEntries maximale Einträge im In-Memory-Cache (Standard: 10000)
     * @param clock      Uhr
     * @param jedisPool  Pool, nur beim Redis-Backend vorhanden
     * @return Key-Value-Cache
     */
    @Bean
    public KeyValueCache keyValueCache(
            @Value("${urlmap.cache.backend:memory}") String backend,
            @Value("${urlmap.cache.max-entries:10000}") int maxEntries,
            Clock clock,
            ObjectProvider<JedisPool> jedisPool) {

        String normalized = backend.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "memory":
                return new MemoryKeyValueCache(maxEntries, clock);
            case "redis":
                JedisPool pool = jedisPool.getIfAvailable();
                if (pool == null) throw new IllegalStateException("Redis backend selected but no JedisPool available");
                return new RedisKeyValueCache(pool);
            default:
                throw new IllegalArgumentException("Unknown cache backend: " + backend);
        }
    }

    @Bean
    public MappingCache mappingCache(MappingStore store, KeyValueCache cache, MappingCacheConfig config) {
        return MappingCache.attach(store, cache, config);
    }

    @Bean
    public Resolver resolver(MappingCache mappingCache) {
        return new Resolver(mappingCache);
    }

    @Bean
    public ContentDispatcher contentDispatcher(HandlerRegistry handlerRegistry) {
        return new ContentDispatcher(handlerRegistry);
    }
}
