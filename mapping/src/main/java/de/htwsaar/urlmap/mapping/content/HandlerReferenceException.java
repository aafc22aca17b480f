package de.htwsaar.urlmap.mapping.content;

/**
 * Eine View-Referenz lässt sich nicht auf registrierte Logik auflösen.
 * Konfigurationsfehler: beim Anlegen eines Handlers sofort, beim Dispatch als interner Fehler.
 */
public class HandlerReferenceException extends RuntimeException {

    private final String view;

    public HandlerReferenceException(String view) {
        super("No content view registered under '" + view + "'");
        this.view = view;
    }

    public String getView() {
        return view;
    }
}
