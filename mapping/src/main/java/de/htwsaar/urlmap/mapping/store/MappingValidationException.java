package de.htwsaar.urlmap.mapping.store;

/**
 * Ein Schreibzugriff verletzt die Invarianten einer Zuordnung.
 * Wird nie stillschweigend korrigiert; die Daten müssen angepasst werden.
 */
public class MappingValidationException extends RuntimeException {

    public MappingValidationException(String message) {
        super(message);
    }
}
