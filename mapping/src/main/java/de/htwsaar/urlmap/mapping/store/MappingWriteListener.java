package de.htwsaar.urlmap.mapping.store;

import de.htwsaar.urlmap.mapping.model.MappingRecord;

/**
 * Wird nach jedem erfolgreichen Schreibzugriff auf den {@link MappingStore} benachrichtigt.
 */
public interface MappingWriteListener {

    /**
     * @param previousDigest Digest vor dem Update oder {@code null} bei Neuanlage
     * @param saved          gespeicherte Zuordnung inkl. ID und aktuellem Digest
     */
    void onSaved(String previousDigest, MappingRecord saved);

    /**
     * @param digest Digest der gelöschten Zuordnung
     */
    default void onDeleted(String digest) {}
}
