package de.htwsaar.urlmap.common.logging;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Konfiguration für Logging und Request-Tracing.
 */
@Configuration
public class LoggingConfig {

    @Bean
    public RequestTraceFilter requestTraceFilter() {
        return new RequestTraceFilter();
    }
}
