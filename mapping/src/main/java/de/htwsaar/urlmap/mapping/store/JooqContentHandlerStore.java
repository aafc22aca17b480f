package de.htwsaar.urlmap.mapping.store;

import static de.htwsaar.urlmap.mapping.store.MappingSchema.CONTENT_HANDLERS;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.ID;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.OPTIONS;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.VIEW;

import de.htwsaar.urlmap.common.serialization.JsonCodec;
import de.htwsaar.urlmap.mapping.content.HandlerRegistry;
import de.htwsaar.urlmap.mapping.model.ContentHandler;
import java.util.Objects;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Record2;
import org.jooq.impl.DSL;

/**
 * {@link ContentHandlerStore} auf SQLite via jOOQ. Optionen werden als JSON abgelegt.
 */
public final class JooqContentHandlerStore implements ContentHandlerStore {

    private final DSLContext dsl;
    private final HandlerRegistry registry;

    public JooqContentHandlerStore(DSLContext dsl, HandlerRegistry registry) {
        this.dsl = Objects.requireNonNull(dsl, "dsl must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public Optional<ContentHandler> findById(long id) {
        Record2<String, String> r =
                dsl.select(VIEW, OPTIONS).from(CONTENT_HANDLERS).where(ID.eq(id)).fetchOne();
        if (r == null) return Optional.empty();
        return Optional.of(new ContentHandler(id, r.value1(), JsonCodec.optionsFromJson(r.value2())));
    }

    @Override
    public ContentHandler save(ContentHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        // schlägt sofort fehl, wenn die View nicht registriert ist
        registry.require(handler.view());
        String options = JsonCodec.toJson(handler.options());

        return dsl.transactionResult(cfg -> {
            DSLContext tx = DSL.using(cfg);
            if (handler.id() == null) {
                tx.insertInto(CONTENT_HANDLERS)
                        .columns(VIEW, OPTIONS)
                        .values(handler.view(), options)
                        .execute();
                Long id = tx.fetchOne("SELECT last_insert_rowid() AS id").get("id", Long.class);
                return handler.withId(id);
            }

            int updated = tx.update(CONTENT_HANDLERS)
                    .set(VIEW, handler.view())
                    .set(OPTIONS, options)
                    .where(ID.eq(handler.id()))
                    .execute();
            if (updated == 0) {
                throw new MappingValidationException("Content handler " + handler.id() + " does not exist");
            }
            return handler;
        });
    }
}
