package me.golemcore.assistant.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import okhttp3.Call;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Builds the outbound HTTP clients of the assistant: declarative Feign clients
 * for request/response calls (Ollama, Brave Search) and raw OkHttp calls for
 * streamed NDJSON bodies. Both share one connection pool and one ObjectMapper.
 *
 * <p>
 * Feign's own retryer is switched off. Callers that retry (rate-limited search)
 * do it themselves with their own backoff.
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public <T> T create(Class<T> apiType, String baseUrl) {
        return builder().target(apiType, normalize(baseUrl));
    }

    /**
     * Creates a client with per-client timeouts, for backends slower than the
     * shared pool defaults.
     */
    public <T> T create(Class<T> apiType, String baseUrl, long connectTimeoutMs, long readTimeoutMs) {
        return builder()
                .options(new Request.Options(connectTimeoutMs, TimeUnit.MILLISECONDS,
                        readTimeoutMs, TimeUnit.MILLISECONDS, true))
                .target(apiType, normalize(baseUrl));
    }

    /**
     * Raw call on the shared pool, for responses read incrementally.
     */
    public Call newCall(okhttp3.Request request) {
        return okHttpClient.newCall(request);
    }

    static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is required");
        }
        String trimmed = baseUrl.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private Feign.Builder builder() {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY);
    }
}
