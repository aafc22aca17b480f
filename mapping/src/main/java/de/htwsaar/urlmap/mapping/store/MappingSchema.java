package de.htwsaar.urlmap.mapping.store;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;

/**
 * Tabellen und Spalten des SQLite-Schemas.
 */
public final class MappingSchema {

    public static final Table<Record> URL_MAPPINGS = table(name("url_mappings"));
    public static final Table<Record> CONTENT_HANDLERS = table(name("content_handlers"));

    public static final Field<Long> ID = field(name("id"), Long.class);
    public static final Field<String> SITE = field(name("site"), String.class);
    public static final Field<String> PATH = field(name("path"), String.class);
    public static final Field<String> DIGEST = field(name("digest"), String.class);
    public static final Field<Integer> STATUS_CODE = field(name("status_code"), Integer.class);
    public static final Field<Long> REDIRECT_ID = field(name("redirect_id"), Long.class);
    public static final Field<Long> CONTENT_HANDLER_ID = field(name("content_handler_id"), Long.class);
    public static final Field<Boolean> FORCE_SECURE = field(name("force_secure"), Boolean.class);

    public static final Field<String> VIEW = field(name("view"), String.class);
    public static final Field<String> OPTIONS = field(name("options"), String.class);

    private MappingSchema() {}

    /**
     * Legt die Tabellen an, falls sie noch nicht existieren.
     *
     * @param dsl jOOQ-Kontext
     */
    public static void create(DSLContext dsl) {
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS content_handlers (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        view TEXT NOT NULL,
                        options TEXT NOT NULL
                    )
                """);
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS url_mappings (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        site TEXT NOT NULL,
                        path TEXT NOT NULL,
                        digest TEXT NOT NULL,
                        status_code INTEGER NOT NULL DEFAULT 200,
                        redirect_id INTEGER REFERENCES url_mappings(id),
                        content_handler_id INTEGER REFERENCES content_handlers(id),
                        force_secure INTEGER NOT NULL DEFAULT 0,
                        UNIQUE (site, path)
                    )
                """);
        dsl.execute("CREATE INDEX IF NOT EXISTS url_mappings_redirect_idx ON url_mappings (redirect_id)");
    }
}
