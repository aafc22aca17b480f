package de.htwsaar.urlmap.router.web;

import de.htwsaar.urlmap.mapping.content.ContentDispatcher;
import de.htwsaar.urlmap.mapping.content.ContentRequest;
import de.htwsaar.urlmap.mapping.content.ContentResponse;
import de.htwsaar.urlmap.mapping.content.HandlerReferenceException;
import de.htwsaar.urlmap.mapping.resolve.Resolver;
import de.htwsaar.urlmap.mapping.resolve.RoutingDecision;
import de.htwsaar.urlmap.router.view.ContentRenderException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;

/**
 * HTTP-Adapter für alle Pfade der konfigurierten Site.
 *
 * <p>Kein Fachcode hier, nur die Übersetzung einer {@link RoutingDecision} in eine HTTP-Antwort.</p>
 */
@RestController
public class RouteController {

    private static final Logger log = LoggerFactory.getLogger(RouteController.class);

    private final Resolver resolver;
    private final ContentDispatcher dispatcher;
    private final String site;

    /**
     * Constructor Injection.
     *
     * @param resolver   Pfadauflösung
     * @param dispatcher Content-Dispatch für {@code SERVE_CONTENT}
     * @param site       Domain, für die dieser Prozess antwortet
     */
    public RouteController(
            Resolver resolver, ContentDispatcher dispatcher, @Value("${urlmap.site:example.com}") String site) {
        this.resolver = resolver;
        this.dispatcher = dispatcher;
        this.site = site;
    }

    /**
     * Löst den angefragten Pfad auf und beantwortet ihn.
     *
     * @param request eingehender Request
     * @return Weiterleitung, Inhalt oder reiner Status
     */
    @RequestMapping(
            value = "/**",
            method = {RequestMethod.GET, RequestMethod.HEAD})
    public ResponseEntity<byte[]> route(HttpServletRequest request) {
        String rawPath = rawPath(request);
        RoutingDecision decision = resolver.resolve(site, rawPath);
        log.debug("Resolved {} -> {} ({})", rawPath, decision.outcome(), decision.statusCode());

        return switch (decision.outcome()) {
            case NOT_FOUND, GONE, BARE_STATUS -> ResponseEntity.status(decision.statusCode()).build();
            case REDIRECT_PERMANENT, REDIRECT_TEMPORARY -> ResponseEntity.status(decision.statusCode())
                    .location(URI.create(decision.location()))
                    .build();
            case SERVE_CONTENT -> serve(decision, request, rawPath);
        };
    }

    @ExceptionHandler(HandlerReferenceException.class)
    public ResponseEntity<String> handleMissingView(HandlerReferenceException ex) {
        log.error("Content view '{}' is referenced but not registered", ex.getView(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Internal Server Error");
    }

    @ExceptionHandler(ContentRenderException.class)
    public ResponseEntity<String> handleRenderFailure(ContentRenderException ex) {
        log.error("Content rendering failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Internal Server Error");
    }

    private ResponseEntity<byte[]> serve(RoutingDecision decision, HttpServletRequest request, String rawPath) {
        ContentRequest contentRequest =
                new ContentRequest(site, rawPath, decision.canonicalPath(), parameters(request));
        ContentResponse response = dispatcher.dispatch(decision.contentHandler(), contentRequest);

        HttpHeaders headers = new HttpHeaders();
        String ct = response.contentType();
        if (ct != null && !ct.isBlank()) headers.setContentType(MediaType.parseMediaType(ct));
        return ResponseEntity.status(response.statusCode()).headers(headers).body(response.body());
    }

    private static String rawPath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        try {
            return UriUtils.decode(uri, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // ungültige Escapes: '%' fällt bei der Kanonisierung ohnehin weg
            log.debug("Malformed escape in {}, resolving undecoded path", uri);
            return uri;
        }
    }

    private static Map<String, List<String>> parameters(HttpServletRequest request) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        request.getParameterMap().forEach((k, v) -> params.put(k, Arrays.asList(v)));
        return params;
    }
}
