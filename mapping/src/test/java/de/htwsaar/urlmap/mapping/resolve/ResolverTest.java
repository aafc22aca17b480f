package de.htwsaar.urlmap.mapping.resolve;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.urlmap.mapping.cache.MappingCache;
import de.htwsaar.urlmap.mapping.cache.MappingCacheConfig;
import de.htwsaar.urlmap.mapping.cache.MemoryKeyValueCache;
import de.htwsaar.urlmap.mapping.model.ContentHandler;
import de.htwsaar.urlmap.mapping.model.MappingRecord;
import de.htwsaar.urlmap.mapping.store.JooqContentHandlerStore;
import de.htwsaar.urlmap.mapping.store.JooqMappingStore;
import de.htwsaar.urlmap.mapping.testutil.SqliteFixture;
import de.htwsaar.urlmap.mapping.testutil.TestViews;
import java.time.Clock;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResolverTest {

    private static final String SITE = "example.com";

    private SqliteFixture db;
    private JooqMappingStore store;
    private JooqContentHandlerStore handlers;
    private Resolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        db = new SqliteFixture();
        store = new JooqMappingStore(db.dsl());
        handlers = new JooqContentHandlerStore(db.dsl(), TestViews.registry());
        resolver = new Resolver(MappingCache.attach(
                store, new MemoryKeyValueCache(1_000, Clock.systemUTC()), MappingCacheConfig.defaults()));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void goneMappingShouldResolveToGone() {
        store.create(SITE, "/410", 410);

        RoutingDecision decision = resolver.resolve(SITE, "/410");

        assertEquals(RoutingOutcome.GONE, decision.outcome());
        assertEquals(410, decision.statusCode());
        assertNull(decision.location());
    }

    @Test
    void permanentRedirectShouldPointToTarget() {
        MappingRecord target = store.create(SITE, "/target", 204);
        store.create(SITE, "/source", 301, target, null, false);

        RoutingDecision decision = resolver.resolve(SITE, "/source");

        assertEquals(RoutingOutcome.REDIRECT_PERMANENT, decision.outcome());
        assertEquals(301, decision.statusCode());
        assertEquals("http://example.com/target", decision.location());
        assertTrue(decision.isRedirect());
    }

    @Test
    void temporaryRedirectShouldUseTargetProtocol() {
        MappingRecord target = store.create(SITE, "/secure", 200, null, null, true);
        store.create(SITE, "/moved", 302, target, null, false);

        RoutingDecision decision = resolver.resolve(SITE, "/moved");

        assertEquals(RoutingOutcome.REDIRECT_TEMPORARY, decision.outcome());
        assertEquals(302, decision.statusCode());
        assertEquals("https://example.com/secure", decision.location());
    }

    @Test
    void nonCanonicalPathShouldRedirectToCanonicalUrl() {
        store.create(SITE, "/test", 200, null, handlers.create(TestViews.ECHO, Map.of()), false);

        RoutingDecision decision = resolver.resolve(SITE, "/TEST");

        assertEquals(RoutingOutcome.REDIRECT_PERMANENT, decision.outcome());
        assertEquals("/test", decision.canonicalPath());
        assertEquals("http://example.com/test", decision.location());
    }

    @Test
    void canonicalPathShouldServeContent() {
        ContentHandler handler = handlers.create(
                TestViews.TEMPLATE, Map.of(ContentHandler.INIT_KWARGS, Map.of("template_name", "base.html")));
        store.create(SITE, "/test", 200, null, handler, false);

        RoutingDecision decision = resolver.resolve(SITE, "/test");

        assertEquals(RoutingOutcome.SERVE_CONTENT, decision.outcome());
        assertEquals(200, decision.statusCode());
        assertEquals(handler, decision.contentHandler());
        assertFalse(decision.isRedirect());
    }

    @Test
    void unknownPathShouldResolveToNotFound() {
        RoutingDecision decision = resolver.resolve(SITE, "/404");

        assertEquals(RoutingOutcome.NOT_FOUND, decision.outcome());
        assertEquals(404, decision.statusCode());
        assertNull(decision.mapping());
    }

    @Test
    void storedNotFoundShouldResolveToNotFound() {
        store.create(SITE, "/hidden", 404);

        RoutingDecision decision = resolver.resolve(SITE, "/hidden");

        assertEquals(RoutingOutcome.NOT_FOUND, decision.outcome());
        assertNotNull(decision.mapping());
    }

    @Test
    void contentStatusWithoutHandlerShouldBeBareStatus() {
        store.create(SITE, "/ping", 204);

        RoutingDecision decision = resolver.resolve(SITE, "/ping");

        assertEquals(RoutingOutcome.BARE_STATUS, decision.outcome());
        assertEquals(204, decision.statusCode());
        assertNull(decision.contentHandler());
    }

    @Test
    void redirectStatusShouldWinOverCanonicalMismatch() {
        MappingRecord target = store.create(SITE, "/new", 204);
        store.create(SITE, "/old", 301, target, null, false);

        RoutingDecision decision = resolver.resolve(SITE, "/OLD/");

        assertEquals("http://example.com/new", decision.location());
    }

    @Test
    void mismatchShouldRedirectEvenForGoneMappings() {
        store.create(SITE, "/retired", 410);

        RoutingDecision decision = resolver.resolve(SITE, "//retired");

        assertEquals(RoutingOutcome.REDIRECT_PERMANENT, decision.outcome());
        assertEquals("http://example.com/retired", decision.location());
    }

    @Test
    void otherSitesShouldNotSeeMapping() {
        store.create(SITE, "/only-here", 204);

        assertEquals(RoutingOutcome.NOT_FOUND, resolver.resolve("example.org", "/only-here").outcome());
    }
}
