package de.htwsaar.urlmap.mapping.store;

import static de.htwsaar.urlmap.mapping.store.MappingSchema.CONTENT_HANDLERS;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.CONTENT_HANDLER_ID;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.DIGEST;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.FORCE_SECURE;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.ID;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.OPTIONS;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.PATH;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.REDIRECT_ID;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.SITE;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.STATUS_CODE;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.URL_MAPPINGS;
import static de.htwsaar.urlmap.mapping.store.MappingSchema.VIEW;

import de.htwsaar.urlmap.common.serialization.JsonCodec;
import de.htwsaar.urlmap.common.util.Digests;
import de.htwsaar.urlmap.common.util.PathCanonicalizer;
import de.htwsaar.urlmap.mapping.model.ContentHandler;
import de.htwsaar.urlmap.mapping.model.MappingRecord;
import de.htwsaar.urlmap.mapping.model.StatusCodes;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MappingStore} auf SQLite via jOOQ.
 *
 * <p>Jeder Schreibzugriff läuft in einer Transaktion (Validierung + Insert/Update);
 * Listener werden erst nach dem Commit benachrichtigt.</p>
 */
public final class JooqMappingStore implements MappingStore {

    private static final Logger log = LoggerFactory.getLogger(JooqMappingStore.class);

    // ein Lesezugriff: Zuordnung + flaches Weiterleitungsziel + Handler
    private static final String SELECT_MAPPING = """
            SELECT m.id, m.site, m.path, m.digest, m.status_code, m.force_secure,
                   t.id AS t_id, t.site AS t_site, t.path AS t_path, t.digest AS t_digest,
                   t.status_code AS t_status_code, t.force_secure AS t_force_secure,
                   h.id AS h_id, h.view AS h_view, h.options AS h_options
            FROM url_mappings m
            LEFT JOIN url_mappings t ON t.id = m.redirect_id
            LEFT JOIN content_handlers h ON h.id = m.content_handler_id
            """;

    private final DSLContext dsl;
    private final List<MappingWriteListener> listeners = new CopyOnWriteArrayList<>();

    public JooqMappingStore(DSLContext dsl) {
        this.dsl = Objects.requireNonNull(dsl, "dsl must not be null");
    }

    @Override
    public Optional<MappingRecord> findByKey(String site, String canonicalPath) {
        if (site == null || canonicalPath == null) return Optional.empty();
        Record r = dsl.fetchOne(SELECT_MAPPING + "WHERE m.site = ? AND m.path = ?", site, canonicalPath);
        return Optional.ofNullable(r).map(JooqMappingStore::toMapping);
    }

    @Override
    public Optional<MappingRecord> findById(long id) {
        Record r = dsl.fetchOne(SELECT_MAPPING + "WHERE m.id = ?", id);
        return Optional.ofNullable(r).map(JooqMappingStore::toMapping);
    }

    @Override
    public MappingRecord save(MappingRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        if (record.site() == null || record.site().isBlank()) {
            throw new MappingValidationException("Mapping requires a site");
        }
        String site = record.site().trim();
        String path = PathCanonicalizer.canonicalize(record.path());
        String digest = Digests.mappingDigest(site, path);

        SaveResult result = dsl.transactionResult(cfg -> {
            DSLContext tx = DSL.using(cfg);
            References refs = validate(tx, record, site, path);
            Long targetId = refs.target() != null ? refs.target().id() : null;
            Long handlerId = refs.handler() != null ? refs.handler().id() : null;

            if (record.id() == null) {
                tx.insertInto(URL_MAPPINGS)
                        .columns(SITE, PATH, DIGEST, STATUS_CODE, REDIRECT_ID, CONTENT_HANDLER_ID, FORCE_SECURE)
                        .values(site, path, digest, record.statusCode(), targetId, handlerId, record.forceSecure())
                        .execute();
                Long id = tx.fetchOne("SELECT last_insert_rowid() AS id").get("id", Long.class);
                return new SaveResult(null, copy(record, id, site, path, digest, refs));
            }

            String previousDigest =
                    tx.select(DIGEST).from(URL_MAPPINGS).where(ID.eq(record.id())).fetchOne(DIGEST);
            if (previousDigest == null) {
                throw new MappingValidationException("Mapping " + record.id() + " does not exist");
            }
            tx.update(URL_MAPPINGS)
                    .set(SITE, site)
                    .set(PATH, path)
                    .set(DIGEST, digest)
                    .set(STATUS_CODE, record.statusCode())
                    .set(REDIRECT_ID, targetId)
                    .set(CONTENT_HANDLER_ID, handlerId)
                    .set(FORCE_SECURE, record.forceSecure())
                    .where(ID.eq(record.id()))
                    .execute();
            return new SaveResult(previousDigest, copy(record, record.id(), site, path, digest, refs));
        });

        MappingRecord saved = result.saved();
        log.debug("Saved mapping id={} site={} path={} status={}", saved.id(), site, path, saved.statusCode());
        for (MappingWriteListener listener : listeners) {
            listener.onSaved(result.previousDigest(), saved);
        }
        return saved;
    }

    @Override
    public boolean delete(long id) {
        String digest = dsl.transactionResult(cfg -> {
            DSLContext tx = DSL.using(cfg);
            if (hasInboundRedirects(tx, id)) {
                throw new MappingValidationException("Mapping " + id + " is still a redirect target");
            }
            String existing = tx.select(DIGEST).from(URL_MAPPINGS).where(ID.eq(id)).fetchOne(DIGEST);
            if (existing != null) {
                tx.deleteFrom(URL_MAPPINGS).where(ID.eq(id)).execute();
            }
            return existing;
        });

        if (digest == null) return false;
        log.debug("Deleted mapping id={}", id);
        for (MappingWriteListener listener : listeners) {
            listener.onDeleted(digest);
        }
        return true;
    }

    @Override
    public void addListener(MappingWriteListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Prüft die Invarianten und lädt Weiterleitungsziel und Handler so, wie sie gespeichert sind.
     *
     * @return gespeicherte Referenzen; Ziel nur bei 301/302
     */
    private References validate(DSLContext tx, MappingRecord record, String site, String path) {
        int status = record.statusCode();
        boolean redirectStatus = StatusCodes.isRedirect(status);
        MappingRecord redirect = record.redirect();

        if (redirectStatus && redirect == null) {
            throw new MappingValidationException("Status " + status + " requires a redirect target");
        }
        if (!redirectStatus && redirect != null) {
            throw new MappingValidationException("Status " + status + " must not carry a redirect target");
        }

        Long existingId = tx.select(ID).from(URL_MAPPINGS).where(SITE.eq(site)).and(PATH.eq(path)).fetchOne(ID);
        if (existingId != null && !existingId.equals(record.id())) {
            throw new MappingValidationException("Path " + path + " is already mapped for site " + site);
        }

        ContentHandler handler = loadHandler(tx, record.contentHandler());

        if (!redirectStatus) return new References(null, handler);

        if (record.id() != null && hasInboundRedirects(tx, record.id())) {
            throw new MappingValidationException(
                    "Mapping " + record.id() + " is a redirect target and cannot become a redirect");
        }
        if (redirect.id() == null) {
            throw new MappingValidationException("Redirect target must be saved before it is referenced");
        }
        if (redirect.id().equals(record.id())) {
            throw new MappingValidationException("Mapping must not redirect to itself");
        }

        Record row = tx.fetchOne(SELECT_MAPPING + "WHERE m.id = ?", redirect.id());
        if (row == null) {
            throw new MappingValidationException("Redirect target " + redirect.id() + " does not exist");
        }
        MappingRecord target = shallow(toMapping(row));
        if (target.site().equals(site) && target.path().equals(path)) {
            throw new MappingValidationException("Mapping must not redirect to itself");
        }
        if (target.hasRedirectStatus()) {
            throw new MappingValidationException(
                    "Redirect target " + target.id() + " is itself a redirect (" + target.statusCode() + ")");
        }
        return new References(target, handler);
    }

    private static ContentHandler loadHandler(DSLContext tx, ContentHandler reference) {
        if (reference == null) return null;
        Record r = reference.id() == null
                ? null
                : tx.select(ID, VIEW, OPTIONS).from(CONTENT_HANDLERS).where(ID.eq(reference.id())).fetchOne();
        if (r == null) {
            throw new MappingValidationException("Content handler must be saved before it is referenced");
        }
        return new ContentHandler(r.get(ID), r.get(VIEW), JsonCodec.optionsFromJson(r.get(OPTIONS)));
    }

    private static boolean hasInboundRedirects(DSLContext tx, long id) {
        return tx.fetchExists(URL_MAPPINGS, REDIRECT_ID.eq(id));
    }

    private static MappingRecord copy(
            MappingRecord source, Long id, String site, String path, String digest, References refs) {
        return new MappingRecord(
                id, site, path, source.statusCode(), refs.target(), refs.handler(), source.forceSecure(), digest);
    }

    private static MappingRecord shallow(MappingRecord r) {
        return new MappingRecord(r.id(), r.site(), r.path(), r.statusCode(), null, null, r.forceSecure(), r.digest());
    }

    private static MappingRecord toMapping(Record r) {
        MappingRecord target = null;
        Long targetId = r.get("t_id", Long.class);
        if (targetId != null) {
            target = new MappingRecord(
                    targetId,
                    r.get("t_site", String.class),
                    r.get("t_path", String.class),
                    r.get("t_status_code", Integer.class),
                    null,
                    null,
                    Boolean.TRUE.equals(r.get("t_force_secure", Boolean.class)),
                    r.get("t_digest", String.class));
        }

        ContentHandler handler = null;
        Long handlerId = r.get("h_id", Long.class);
        if (handlerId != null) {
            handler = new ContentHandler(
                    handlerId, r.get("h_view", String.class), JsonCodec.optionsFromJson(r.get("h_options", String.class)));
        }

        return new MappingRecord(
                r.get("id", Long.class),
                r.get("site", String.class),
                r.get("path", String.class),
                r.get("status_code", Integer.class),
                target,
                handler,
                Boolean.TRUE.equals(r.get("force_secure", Boolean.class)),
                r.get("digest", String.class));
    }

    private record SaveResult(String previousDigest, MappingRecord saved) {}

    private record References(MappingRecord target, ContentHandler handler) {}
}
