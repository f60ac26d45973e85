package com.example.chat.shared.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.WebFilter;
import reactor.core.publisher.Mono;

@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    /**
     * Request/response logging for the HTTP surface. Headers are not logged, they carry
     * bearer tokens.
     */
    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            long startTime = System.currentTimeMillis();
            String path = exchange.getRequest().getURI().getPath();
            String method = exchange.getRequest().getMethod().name();

            String correlationId = exchange.getAttribute(CorrelationIdFilter.CORRELATION_ID_ATTRIBUTE);

            if (log.isDebugEnabled()) {
                log.debug("Incoming request {}: {} {} from {}", correlationId, method, path,
                        String.valueOf(exchange.getRequest().getRemoteAddress()));
            }

            return chain.filter(exchange)
                    .then(Mono.fromRunnable(() -> {
                        if (log.isDebugEnabled()) {
                            long duration = System.currentTimeMillis() - startTime;
                            log.debug("Outgoing response {}: {} {} - {} in {}ms", correlationId, method, path,
                                    exchange.getResponse().getStatusCode(), duration);
                        }
                    }));
        };
    }
}
