package de.htwsaar.urlmap.mapping.store;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.urlmap.mapping.content.HandlerReferenceException;
import de.htwsaar.urlmap.mapping.model.ContentHandler;
import de.htwsaar.urlmap.mapping.testutil.SqliteFixture;
import de.htwsaar.urlmap.mapping.testutil.TestViews;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JooqContentHandlerStoreTest {

    private SqliteFixture db;
    private JooqContentHandlerStore handlers;

    @BeforeEach
    void setUp() throws Exception {
        db = new SqliteFixture();
        handlers = new JooqContentHandlerStore(db.dsl(), TestViews.registry());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void unknownViewShouldFailOnCreate() {
        HandlerReferenceException ex = assertThrows(
                HandlerReferenceException.class, () -> handlers.create("views.nonexistent", Map.of()));

        assertEquals("views.nonexistent", ex.getView());
        assertTrue(handlers.findById(1).isEmpty());
    }

    @Test
    void createShouldPersistOptionsInOrder() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(ContentHandler.INIT_KWARGS, Map.of("template_name", "base.html"));
        options.put("zeta", 1);
        options.put("alpha", List.of("a", "b"));

        ContentHandler saved = handlers.create(TestViews.TEMPLATE, options);

        assertEquals(1L, saved.id());
        ContentHandler loaded = handlers.findById(saved.id()).orElseThrow();
        assertEquals(TestViews.TEMPLATE, loaded.view());
        assertEquals(List.of(ContentHandler.INIT_KWARGS, "zeta", "alpha"), List.copyOf(loaded.options().keySet()));
        assertEquals("base.html", loaded.initkwargs().get("template_name"));
        assertEquals(List.of("zeta", "alpha"), List.copyOf(loaded.callOptions().keySet()));
    }

    @Test
    void saveShouldUpdateExistingHandler() {
        ContentHandler saved = handlers.create(TestViews.ECHO, Map.of("a", 1));

        handlers.save(new ContentHandler(saved.id(), TestViews.TEMPLATE, Map.of("b", 2)));

        ContentHandler loaded = handlers.findById(saved.id()).orElseThrow();
        assertEquals(TestViews.TEMPLATE, loaded.view());
        assertEquals(Map.of("b", 2), loaded.options());
    }

    @Test
    void updateOfUnknownIdShouldFail() {
        assertThrows(
                MappingValidationException.class,
                () -> handlers.save(new ContentHandler(42L, TestViews.ECHO, Map.of())));
    }
}
