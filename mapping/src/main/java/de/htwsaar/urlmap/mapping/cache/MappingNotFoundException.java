package de.htwsaar.urlmap.mapping.cache;

/**
 * Für (Site, Pfad) existiert keine Zuordnung.
 */
public class MappingNotFoundException extends RuntimeException {

    private final String site;
    private final String path;

    public MappingNotFoundException(String site, String path) {
        super("No mapping for " + site + path);
        this.site = site;
        this.path = path;
    }

    public String getSite() {
        return site;
    }

    public String getPath() {
        return path;
    }
}
