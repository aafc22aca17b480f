package de.htwsaar.urlmap.mapping.store;

import de.htwsaar.urlmap.mapping.model.ContentHandler;
import de.htwsaar.urlmap.mapping.model.MappingRecord;
import java.util.Optional;

/**
 * Autoritative, persistente Ablage der Zuordnungen.
 * Implementierungen müssen für nebenläufige Nutzung sicher sein.
 */
public interface MappingStore {

    /**
     * @param site          Site-Domain
     * @param canonicalPath kanonischer Pfad
     * @return Zuordnung oder leer
     */
    Optional<MappingRecord> findByKey(String site, String canonicalPath);

    Optional<MappingRecord> findById(long id);

    /**
     * Legt an oder aktualisiert (per ID). Kanonisiert den Pfad, berechnet den Digest neu
     * und benachrichtigt alle {@link MappingWriteListener}.
     *
     * @param record zu speichernde Zuordnung
     * @return gespeicherte Zuordnung mit ID und Digest
     * @throws MappingValidationException bei verletzten Invarianten
     */
    MappingRecord save(MappingRecord record);

    /**
     * Löscht eine Zuordnung.
     *
     * @param id ID der Zuordnung
     * @return {@code true}, wenn ein Eintrag entfernt wurde
     * @throws MappingValidationException wenn noch Weiterleitungen auf die Zuordnung zeigen
     */
    boolean delete(long id);

    void addListener(MappingWriteListener listener);

    default MappingRecord create(String site, String path, int statusCode) {
        return save(MappingRecord.of(site, path, statusCode));
    }

    default MappingRecord create(
            String site,
            String path,
            int statusCode,
            MappingRecord redirect,
            ContentHandler contentHandler,
            boolean forceSecure) {

        return save(MappingRecord.of(site, path, statusCode)
                .withRedirect(redirect)
                .withContentHandler(contentHandler)
                .withForceSecure(forceSecure));
    }
}
