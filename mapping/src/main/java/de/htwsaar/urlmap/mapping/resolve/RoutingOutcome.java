package de.htwsaar.urlmap.mapping.resolve;

/**
 * Mögliche Ergebnisse der Pfadauflösung.
 */
public enum RoutingOutcome {
    NOT_FOUND,
    GONE,
    REDIRECT_PERMANENT,
    REDIRECT_TEMPORARY,
    SERVE_CONTENT,
    /** gespeicherter Status ohne Body, z. B. 204 */
    BARE_STATUS
}
