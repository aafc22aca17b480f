package de.htwsaar.urlmap.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter für die Log-Korrelation von Routing-Anfragen.
 *
 * <p>Übernimmt die Trace-ID aus {@value #TRACE_ID_HEADER} oder erzeugt eine neue,
 * legt sie zusammen mit dem angefragten Pfad im MDC ab und spiegelt sie in der Antwort.</p>
 */
public class RequestTraceFilter extends OncePerRequestFilter {

    /** MDC-Schlüssel der Trace-ID */
    public static final String TRACE_ID_KEY = "traceId";

    /** MDC-Schlüssel des rohen Request-Pfads */
    public static final String REQUEST_PATH_KEY = "requestPath";

    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = request.getHeader(TRACE_ID_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(REQUEST_PATH_KEY, request.getRequestURI());
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(REQUEST_PATH_KEY);
        }
    }
}
