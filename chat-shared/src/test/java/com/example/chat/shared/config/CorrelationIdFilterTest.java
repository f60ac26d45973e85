package com.example.chat.shared.config;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void wellFormedIdIsReusedEchoedAndVisibleWhileHandling() {
        MockServerWebExchange exchange = exchangeWith("match-42.retry_1");
        AtomicReference<String> seenInMdc = new AtomicReference<>();
        WebFilterChain chain = ex -> {
            seenInMdc.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
            return Mono.empty();
        };

        filter.filter(exchange, chain).block();

        assertThat(seenInMdc.get()).isEqualTo("match-42.retry_1");
        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isEqualTo("match-42.retry_1");
        assertThat((String) exchange.getAttribute(CorrelationIdFilter.CORRELATION_ID_ATTRIBUTE)).isEqualTo("match-42.retry_1");
        assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY)).isNull();
    }

    @Test
    void idThatCouldForgeLogLinesIsReplaced() {
        MockServerWebExchange exchange = exchangeWith("abc\n2024-01-01 INFO fake entry");

        filter.filter(exchange, ex -> Mono.empty()).block();

        String echoed = exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER);
        assertThat(echoed).doesNotContain("fake").matches("[0-9a-f-]{36}");
    }

    @Test
    void oversizedOrMissingIdIsGenerated() {
        assertThat(CorrelationIdFilter.resolve("x".repeat(65))).hasSize(36);
        assertThat(CorrelationIdFilter.resolve(null)).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("")).hasSize(36);
        assertThat(CorrelationIdFilter.resolve(null)).isNotEqualTo(CorrelationIdFilter.resolve(null));
    }

    private static MockServerWebExchange exchangeWith(String correlationId) {
        return MockServerWebExchange.from(MockServerHttpRequest.get("/api/chat/history")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId));
    }
}
