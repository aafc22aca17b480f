package de.htwsaar.urlmap.mapping.testutil;

import de.htwsaar.urlmap.mapping.store.MappingSchema;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.sqlite.SQLiteDataSource;

/**
 * Temporäre SQLite-Datenbank mit angelegtem Schema.
 */
public final class SqliteFixture implements AutoCloseable {

    private final Path dir;
    private final DSLContext dsl;

    public SqliteFixture() throws IOException {
        this.dir = Files.createTempDirectory("urlmap-test-");
        SQLiteDataSource ds = new SQLiteDataSource();
        ds.setUrl("jdbc:sqlite:" + dir.resolve("urlmap.db"));
        this.dsl = DSL.using(ds, SQLDialect.SQLITE);
        MappingSchema.create(dsl);
    }

    public DSLContext dsl() {
        return dsl;
    }

    @Override
    public void close() {
        try (Stream<Path> files = Files.walk(dir)) {
            files.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
