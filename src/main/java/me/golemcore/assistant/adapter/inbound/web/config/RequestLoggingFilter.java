package me.golemcore.assistant.adapter.inbound.web.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Set;

/**
 * Adds security headers and the {@code X-Process-Time} header (seconds) to every
 * response, and logs API requests other than health checks.
 */
@Component
@Slf4j
public class RequestLoggingFilter implements WebFilter {

    private static final Set<String> QUIET_PATHS = Set.of("/health", "/favicon.ico");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long start = System.nanoTime();
        String method = exchange.getRequest().getMethod().name();
        String path = exchange.getRequest().getPath().value();
        boolean quiet = QUIET_PATHS.contains(path);
        if (!quiet) {
            log.info("[API] Request: {} {}", method, path);
        }

        ServerHttpResponse response = exchange.getResponse();
        response.beforeCommit(() -> {
            HttpHeaders headers = response.getHeaders();
            headers.set("X-Content-Type-Options", "nosniff");
            headers.set("X-Frame-Options", "DENY");
            headers.set("X-XSS-Protection", "1; mode=block");
            headers.set("Referrer-Policy", "strict-origin-when-cross-origin");
            headers.set("X-Process-Time", formatSeconds(System.nanoTime() - start));
            return Mono.empty();
        });

        return chain.filter(exchange)
                .doFinally(signal -> {
                    if (!quiet) {
                        log.info("[API] Response: {} {} -> {} in {}s", method, path,
                                response.getStatusCode(), formatSeconds(System.nanoTime() - start));
                    }
                });
    }

    static String formatSeconds(long nanos) {
        return String.format(Locale.ROOT, "%.3f", nanos / 1_000_000_000.0);
    }
}
