package de.htwsaar.urlmap.mapping.model;

/**
 * Bindung von (Site, Pfad) an ein Routing-Ergebnis.
 *
 * <p>Unveränderlich; der Store liefert beim Speichern eine neue Instanz mit ID und Digest.
 * {@code redirect} ist eine flache Kopie des Ziels (ohne eigenes Ziel und ohne Handler).</p>
 *
 * @param id             vom Store vergebene ID ({@code null} vor dem ersten Speichern)
 * @param site           Domain der Site, z. B. {@code example.com}
 * @param path           kanonischer Pfad, eindeutig je Site
 * @param statusCode     steuernder HTTP-Status
 * @param redirect       Weiterleitungsziel, nur bei 301/302
 * @param contentHandler optionaler Content-Handler
 * @param forceSecure    {@code true} für https
 * @param digest         SHA-256 über Site und Pfad (Cache-Schlüssel)
 */
public record MappingRecord(
        Long id,
        String site,
        String path,
        int statusCode,
        MappingRecord redirect,
        ContentHandler contentHandler,
        boolean forceSecure,
        String digest) {

    public static MappingRecord of(String site, String path, int statusCode) {
        return new MappingRecord(null, site, path, statusCode, null, null, false, null);
    }

    public MappingRecord withStatusCode(int newStatusCode) {
        return new MappingRecord(id, site, path, newStatusCode, redirect, contentHandler, forceSecure, digest);
    }

    public MappingRecord withRedirect(MappingRecord target) {
        return new MappingRecord(id, site, path, statusCode, target, contentHandler, forceSecure, digest);
    }

    public MappingRecord withContentHandler(ContentHandler handler) {
        return new MappingRecord(id, site, path, statusCode, redirect, handler, forceSecure, digest);
    }

    public MappingRecord withForceSecure(boolean secure) {
        return new MappingRecord(id, site, path, statusCode, redirect, contentHandler, secure, digest);
    }

    public MappingRecord withLocation(String newSite, String newPath) {
        return new MappingRecord(id, newSite, newPath, statusCode, redirect, contentHandler, forceSecure, digest);
    }

    public String protocol() {
        return forceSecure ? "https" : "http";
    }

    /**
     * Absolute URL dieser Zuordnung, z. B. {@code http://example.com/test}.
     *
     * @return URL aus Protokoll, Site und Pfad
     */
    public String absoluteUrl() {
        return protocol() + "://" + site + path;
    }

    public boolean hasRedirectStatus() {
        return StatusCodes.isRedirect(statusCode);
    }
}
