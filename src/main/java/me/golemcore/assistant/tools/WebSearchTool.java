package me.golemcore.assistant.tools;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.DangerLevel;
import me.golemcore.assistant.domain.model.ToolCategory;
import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolParameter;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.infrastructure.http.FeignClientFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Web search through the Brave Search API. Reports itself disabled until an
 * API key is configured.
 */
@Component
@Lazy
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COUNT = "count";

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int MAX_COUNT = 20;

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name("web_search")
            .description("Search the web. Returns titles, URLs and descriptions of the top results")
            .category(ToolCategory.WEB)
            .parameter(ToolParameter.string(PARAM_QUERY, "The search query"))
            .parameter(ToolParameter.builder()
                    .name(PARAM_COUNT)
                    .type(ToolParameter.TYPE_INTEGER)
                    .description("Number of results (1-20)")
                    .required(false)
                    .build())
            .dangerLevel(DangerLevel.LOW)
            .requiresConfirmation(false)
            .example("[TOOL: web_search(\"Python tutorials\")]")
            .build();

    private final FeignClientFactory feignClientFactory;
    private final AssistantProperties properties;

    private BraveSearchApi searchApi;
    private boolean enabled;
    private String apiKey;
    private int defaultCount;

    @PostConstruct
    public void init() {
        AssistantProperties.WebSearchProperties config = properties.getTools().getWebSearch();
        this.apiKey = config.getApiKey();
        this.defaultCount = config.getDefaultCount();
        this.enabled = config.isEnabled();

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("[Tools] Web search is enabled but API key is not configured. Disabling.");
            this.enabled = false;
        }
        if (enabled) {
            this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBaseUrl());
            log.info("[Tools] Web search initialized (default results: {})", defaultCount);
        }
    }

    @Override
    public ToolMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(String sessionId, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String query = String.valueOf(parameters.get(PARAM_QUERY));
            int count = Math.max(1, Math.min(MAX_COUNT, parseCount(parameters.get(PARAM_COUNT))));
            return executeWithRetry(query, count);
        });
    }

    private int parseCount(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && s.trim().matches("-?\\d+")) {
            return Integer.parseInt(s.trim());
        }
        return defaultCount;
    }

    private ToolResult executeWithRetry(String query, int count) {
        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                log.debug("[Tools] Web search: query='{}', count={}, attempt={}", query, count, attempt);
                BraveSearchResponse response = searchApi.search(apiKey, query, count);
                return buildSuccessResult(query, response);
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < MAX_RETRIES) {
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Tools] Web search rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleepBeforeRetry(backoffMs);
                } else if (e.status() == HTTP_TOO_MANY_REQUESTS) {
                    log.error("[Tools] Web search rate limit exceeded after {} retries for query: {}",
                            MAX_RETRIES, query);
                    return ToolResult.failure("Search rate limit exceeded, try again later");
                } else {
                    log.error("[Tools] Web search API error (status {}) for query: {}", e.status(), query, e);
                    return ToolResult.failure("Search failed: HTTP " + e.status());
                }
            }
        }
        return ToolResult.failure("Search failed");
    }

    protected void sleepBeforeRetry(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Web search retry sleep interrupted", e);
        }
    }

    private ToolResult buildSuccessResult(String query, BraveSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null
                || response.getWeb().getResults().isEmpty()) {
            return ToolResult.success("No results found for: " + query);
        }

        List<WebResult> results = response.getWeb().getResults();
        String output = results.stream()
                .map(r -> String.format("**%s**%n%s%n%s",
                        r.getTitle(),
                        r.getUrl(),
                        r.getDescription() != null ? r.getDescription() : ""))
                .collect(Collectors.joining("\n\n"));
        String header = String.format("Search results for \"%s\" (%d results):%n%n", query, results.size());

        return ToolResult.success(header + output, Map.of(
                PARAM_QUERY, query,
                PARAM_COUNT, results.size(),
                "results", results.stream()
                        .map(r -> Map.of(
                                "title", r.getTitle() != null ? r.getTitle() : "",
                                "url", r.getUrl() != null ? r.getUrl() : "",
                                "description", r.getDescription() != null ? r.getDescription() : ""))
                        .toList()));
    }

    // Feign API interface
    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
