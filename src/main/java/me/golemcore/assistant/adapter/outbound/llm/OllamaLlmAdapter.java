package me.golemcore.assistant.adapter.outbound.llm;

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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Headers;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.exception.InferenceUnavailableException;
import me.golemcore.assistant.domain.model.ContextMessage;
import me.golemcore.assistant.domain.model.LlmChunk;
import me.golemcore.assistant.domain.model.LlmRequest;
import me.golemcore.assistant.domain.model.LlmResponse;
import me.golemcore.assistant.domain.model.LlmUsage;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.infrastructure.http.FeignClientFactory;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Ollama chat backend. Blocking calls go through a Feign client; streaming
 * reads the newline-delimited JSON body of {@code POST /api/chat} directly from
 * OkHttp so each fragment is forwarded as soon as it arrives.
 *
 * <p>
 * The startup probe is best effort: when Ollama is unreachable the adapter
 * logs the failure and keeps serving, reporting itself unavailable until the
 * backend answers {@code GET /api/tags}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OllamaLlmAdapter implements LlmProviderAdapter {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final AssistantProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;

    private volatile OllamaApi client;
    private volatile String currentModel;
    private volatile List<String> availableModels = List.of();
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        currentModel = properties.getLlm().getModel();
        initialized = true;
        try {
            List<String> models = listModels();
            availableModels = models;
            log.info("[LLM] Connected to Ollama. Available models: {}", models);
            currentModel = resolveModel(currentModel, models);
            log.info("[LLM] Using model: {}", currentModel);
        } catch (RuntimeException e) {
            log.error("[LLM] Failed to connect to Ollama at {}: {}", baseUrl(), e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    /**
     * Picks the configured model, its un-tagged name, or the first available one.
     */
    static String resolveModel(String configured, List<String> available) {
        if (available.contains(configured)) {
            return configured;
        }
        String untagged = configured.split(":")[0];
        if (available.contains(untagged)) {
            log.warn("[LLM] Default model not found, falling back to '{}'", untagged);
            return untagged;
        }
        if (!available.isEmpty()) {
            log.warn("[LLM] Default model not found, using '{}' instead", available.get(0));
            return available.get(0);
        }
        log.warn("[LLM] No models available in Ollama, keeping '{}'", configured);
        return configured;
    }

    @Override
    public String getProviderId() {
        return "ollama";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            OllamaChatRequest apiRequest = buildRequest(request, false);
            OllamaChatResponse apiResponse;
            try {
                apiResponse = client().chat(apiRequest);
            } catch (RuntimeException e) {
                log.error("[LLM] Ollama chat failed: {}", e.getMessage());
                throw new InferenceUnavailableException("Ollama chat failed: " + e.getMessage(), e);
            }
            if (apiResponse == null) {
                throw new InferenceUnavailableException("Ollama returned an empty response");
            }
            if (apiResponse.getError() != null) {
                throw new InferenceUnavailableException("Ollama error: " + apiResponse.getError());
            }
            return LlmResponse.builder()
                    .content(apiResponse.getMessage() != null ? apiResponse.getMessage().getContent() : "")
                    .model(apiResponse.getModel())
                    .finishReason(apiResponse.getDoneReason() != null ? apiResponse.getDoneReason() : "stop")
                    .usage(usageOf(apiResponse))
                    .build();
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            ensureInitialized();
            Request httpRequest;
            try {
                httpRequest = new Request.Builder()
                        .url(baseUrl() + "/api/chat")
                        .post(RequestBody.create(objectMapper.writeValueAsString(buildRequest(request, true)), JSON))
                        .build();
            } catch (JsonProcessingException e) {
                sink.error(new InferenceUnavailableException("Failed to encode Ollama request", e));
                return;
            }
            Call call = feignClientFactory.newCall(httpRequest);
            sink.onDispose(call::cancel);
            call.enqueue(new Callback() {
                @Override
                public void onFailure(Call failed, IOException e) {
                    if (!failed.isCanceled()) {
                        log.error("[LLM] Ollama stream failed: {}", e.getMessage());
                        sink.error(new InferenceUnavailableException("Ollama unreachable: " + e.getMessage(), e));
                    }
                }

                @Override
                public void onResponse(Call active, Response response) {
                    readStream(active, response, sink);
                }
            });
        });
    }

    private void readStream(Call call, Response response, FluxSink<LlmChunk> sink) {
        try (ResponseBody body = response.body()) {
            if (!response.isSuccessful() || body == null) {
                sink.error(new InferenceUnavailableException("Ollama returned status " + response.code()));
                return;
            }
            BufferedSource source = body.source();
            String line;
            while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                OllamaChatResponse fragment = objectMapper.readValue(line, OllamaChatResponse.class);
                if (fragment.getError() != null) {
                    sink.error(new InferenceUnavailableException("Ollama error: " + fragment.getError()));
                    return;
                }
                String text = fragment.getMessage() != null && fragment.getMessage().getContent() != null
                        ? fragment.getMessage().getContent()
                        : "";
                sink.next(LlmChunk.builder()
                        .text(text)
                        .done(fragment.isDone())
                        .usage(fragment.isDone() ? usageOf(fragment) : null)
                        .build());
                if (fragment.isDone()) {
                    break;
                }
            }
            sink.complete();
        } catch (IOException e) {
            if (!call.isCanceled()) {
                log.error("[LLM] Ollama stream interrupted: {}", e.getMessage());
                sink.error(new InferenceUnavailableException("Ollama stream interrupted: " + e.getMessage(), e));
            }
        }
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public List<String> getSupportedModels() {
        return availableModels;
    }

    @Override
    public String getCurrentModel() {
        return currentModel;
    }

    /**
     * Live probe: the backend is available when {@code GET /api/tags} succeeds.
     */
    @Override
    public boolean isAvailable() {
        try {
            availableModels = listModels();
            return true;
        } catch (RuntimeException e) {
            log.debug("[LLM] Ollama health check failed: {}", e.getMessage());
            return false;
        }
    }

    private List<String> listModels() {
        OllamaTagsResponse tags = client().tags();
        List<String> names = new ArrayList<>();
        if (tags != null && tags.getModels() != null) {
            tags.getModels().forEach(model -> names.add(model.getName()));
        }
        return List.copyOf(names);
    }

    private OllamaChatRequest buildRequest(LlmRequest request, boolean stream) {
        List<OllamaMessage> messages = new ArrayList<>();
        for (ContextMessage message : request.getMessages()) {
            messages.add(new OllamaMessage(message.role(), message.content()));
        }
        OllamaOptions options = new OllamaOptions();
        options.setTemperature(request.getTemperature());
        options.setNumPredict(request.getMaxTokens());

        OllamaChatRequest apiRequest = new OllamaChatRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : currentModel);
        apiRequest.setMessages(messages);
        apiRequest.setStream(stream);
        apiRequest.setOptions(options);
        return apiRequest;
    }

    private static LlmUsage usageOf(OllamaChatResponse response) {
        int input = response.getPromptEvalCount() != null ? response.getPromptEvalCount() : 0;
        int output = response.getEvalCount() != null ? response.getEvalCount() : 0;
        return LlmUsage.builder()
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(input + output)
                .build();
    }

    private OllamaApi client() {
        OllamaApi current = client;
        if (current == null) {
            synchronized (this) {
                if (client == null) {
                    AssistantProperties.HttpProperties http = properties.getHttp();
                    client = feignClientFactory.create(OllamaApi.class, baseUrl(), http.getConnectTimeout(),
                            http.getReadTimeout());
                }
                current = client;
            }
        }
        return current;
    }

    private String baseUrl() {
        String url = properties.getLlm().getOllama().getBaseUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Feign API interface
    public interface OllamaApi {
        @RequestLine("POST /api/chat")
        @Headers("Content-Type: application/json")
        OllamaChatResponse chat(OllamaChatRequest request);

        @RequestLine("GET /api/tags")
        OllamaTagsResponse tags();
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OllamaChatRequest {
        private String model;
        private List<OllamaMessage> messages;
        private boolean stream;
        private OllamaOptions options;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaMessage {
        private String role;
        private String content;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OllamaOptions {
        private Double temperature;
        @JsonProperty("num_predict")
        private Integer numPredict;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaChatResponse {
        private String model;
        private OllamaMessage message;
        private boolean done;
        @JsonProperty("done_reason")
        private String doneReason;
        @JsonProperty("prompt_eval_count")
        private Integer promptEvalCount;
        @JsonProperty("eval_count")
        private Integer evalCount;
        private String error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaTagsResponse {
        private List<OllamaModel> models;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaModel {
        private String name;
        private Long size;
    }
}
