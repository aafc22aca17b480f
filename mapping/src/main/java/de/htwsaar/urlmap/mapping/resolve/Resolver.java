package de.htwsaar.urlmap.mapping.resolve;

import de.htwsaar.urlmap.common.util.PathCanonicalizer;
import de.htwsaar.urlmap.mapping.cache.MappingCache;
import de.htwsaar.urlmap.mapping.model.MappingRecord;
import de.htwsaar.urlmap.mapping.model.StatusCodes;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zustandsautomat: (Site, roher Pfad) → {@link RoutingDecision}.
 *
 * <p>Reihenfolge: Weiterleitungsstatus vor Kanonisierungs-Redirect, danach Gone/Not-Found,
 * Content-Handler und zuletzt der reine Status. Weiterleitungsziele werden genau einen
 * Schritt aufgelöst; Ketten verhindert der Store beim Schreiben.</p>
 */
public class Resolver {

    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    private final MappingCache mappingCache;

    public Resolver(MappingCache mappingCache) {
        this.mappingCache = Objects.requireNonNull(mappingCache, "mappingCache must not be null");
    }

    /**
     * @param site    Site-Domain
     * @param rawPath Request-Pfad wie empfangen
     * @return Routing-Entscheidung
     */
    public RoutingDecision resolve(String site, String rawPath) {
        String canonical = PathCanonicalizer.canonicalize(rawPath);
        boolean mismatch = !canonical.equals(rawPath);

        Optional<MappingRecord> found = mappingCache.get(site, canonical);
        if (found.isEmpty()) {
            log.debug("No mapping for {}{}", site, canonical);
            return RoutingDecision.notFound(canonical, null);
        }

        MappingRecord mapping = found.get();
        int status = mapping.statusCode();

        if (StatusCodes.isRedirect(status)) {
            MappingRecord target = mapping.redirect();
            if (target == null) {
                throw new IllegalStateException("Redirect mapping " + mapping.id() + " has no target");
            }
            return status == StatusCodes.MOVED_PERMANENTLY
                    ? RoutingDecision.permanentRedirect(canonical, target.absoluteUrl(), mapping)
                    : RoutingDecision.temporaryRedirect(canonical, target.absoluteUrl(), mapping);
        }

        if (mismatch) {
            return RoutingDecision.permanentRedirect(canonical, mapping.absoluteUrl(), mapping);
        }

        if (status == StatusCodes.GONE) return RoutingDecision.gone(canonical, mapping);
        if (status == StatusCodes.NOT_FOUND) return RoutingDecision.notFound(canonical, mapping);

        if (StatusCodes.isContent(status) && mapping.contentHandler() != null) {
            return RoutingDecision.serveContent(canonical, mapping);
        }
        return RoutingDecision.bareStatus(canonical, mapping);
    }
}
