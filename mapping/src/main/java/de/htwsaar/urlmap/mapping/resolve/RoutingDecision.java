package de.htwsaar.urlmap.mapping.resolve;

import de.htwsaar.urlmap.mapping.model.ContentHandler;
import de.htwsaar.urlmap.mapping.model.MappingRecord;
import de.htwsaar.urlmap.mapping.model.StatusCodes;
import java.util.Objects;

/**
 * Fachliches Ergebnis einer Auflösung, ohne HTTP-Framework-Typen.
 *
 * @param outcome       Ergebnisart
 * @param statusCode    auszugebender HTTP-Status
 * @param canonicalPath kanonischer Pfad der Anfrage
 * @param location      absolute Ziel-URL bei Weiterleitungen, sonst {@code null}
 * @param mapping       gefundene Zuordnung, bei {@link RoutingOutcome#NOT_FOUND} ggf. {@code null}
 */
public record RoutingDecision(
        RoutingOutcome outcome, int statusCode, String canonicalPath, String location, MappingRecord mapping) {

    public RoutingDecision {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(canonicalPath, "canonicalPath must not be null");
    }

    static RoutingDecision notFound(String canonicalPath, MappingRecord mapping) {
        return new RoutingDecision(RoutingOutcome.NOT_FOUND, StatusCodes.NOT_FOUND, canonicalPath, null, mapping);
    }

    static RoutingDecision gone(String canonicalPath, MappingRecord mapping) {
        return new RoutingDecision(RoutingOutcome.GONE, StatusCodes.GONE, canonicalPath, null, mapping);
    }

    static RoutingDecision permanentRedirect(String canonicalPath, String location, MappingRecord mapping) {
        return new RoutingDecision(
                RoutingOutcome.REDIRECT_PERMANENT, StatusCodes.MOVED_PERMANENTLY, canonicalPath, location, mapping);
    }

    static RoutingDecision temporaryRedirect(String canonicalPath, String location, MappingRecord mapping) {
        return new RoutingDecision(RoutingOutcome.REDIRECT_TEMPORARY, StatusCodes.FOUND, canonicalPath, location, mapping);
    }

    static RoutingDecision serveContent(String canonicalPath, MappingRecord mapping) {
        return new RoutingDecision(
                RoutingOutcome.SERVE_CONTENT, mapping.statusCode(), canonicalPath, null, mapping);
    }

    static RoutingDecision bareStatus(String canonicalPath, MappingRecord mapping) {
        return new RoutingDecision(RoutingOutcome.BARE_STATUS, mapping.statusCode(), canonicalPath, null, mapping);
    }

    public boolean isRedirect() {
        return outcome == RoutingOutcome.REDIRECT_PERMANENT || outcome == RoutingOutcome.REDIRECT_TEMPORARY;
    }

    /**
     * @return Handler bei {@link RoutingOutcome#SERVE_CONTENT}, sonst {@code null}
     */
    public ContentHandler contentHandler() {
        return outcome == RoutingOutcome.SERVE_CONTENT ? mapping.contentHandler() : null;
    }
}
