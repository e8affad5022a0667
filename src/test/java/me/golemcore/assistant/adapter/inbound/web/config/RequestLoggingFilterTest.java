package me.golemcore.assistant.adapter.inbound.web.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @Test
    void shouldAddSecurityAndTimingHeaders() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/chat/stats"));
        AtomicBoolean called = new AtomicBoolean();
        WebFilterChain chain = ex -> {
            called.set(true);
            return ex.getResponse().setComplete();
        };

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertTrue(called.get());
        HttpHeaders headers = exchange.getResponse().getHeaders();
        assertEquals("nosniff", headers.getFirst("X-Content-Type-Options"));
        assertEquals("DENY", headers.getFirst("X-Frame-Options"));
        assertEquals("1; mode=block", headers.getFirst("X-XSS-Protection"));
        assertEquals("strict-origin-when-cross-origin", headers.getFirst("Referrer-Policy"));
        assertTrue(headers.getFirst("X-Process-Time").matches("\\d+\\.\\d{3}"));
    }

    @Test
    void shouldDecorateQuietPathsToo() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/health"));

        StepVerifier.create(filter.filter(exchange, ex -> ex.getResponse().setComplete())).verifyComplete();

        assertNotNull(exchange.getResponse().getHeaders().getFirst("X-Process-Time"));
    }

    @Test
    void shouldFormatNanosAsSeconds() {
        assertEquals("0.000", RequestLoggingFilter.formatSeconds(0));
        assertEquals("1.500", RequestLoggingFilter.formatSeconds(1_500_000_000L));
        assertEquals("0.012", RequestLoggingFilter.formatSeconds(12_345_678L));
    }
}
