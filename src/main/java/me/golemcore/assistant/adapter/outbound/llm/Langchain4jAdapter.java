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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.exception.InferenceUnavailableException;
import me.golemcore.assistant.domain.model.ContextMessage;
import me.golemcore.assistant.domain.model.LlmChunk;
import me.golemcore.assistant.domain.model.LlmRequest;
import me.golemcore.assistant.domain.model.LlmResponse;
import me.golemcore.assistant.domain.model.LlmUsage;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * OpenAI-compatible chat through langchain4j. Rate limits are retried with
 * exponential backoff; other failures surface as
 * {@link InferenceUnavailableException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final AssistantProperties properties;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        String model = properties.getLlm().getModel();
        this.currentModel = model;
        try {
            this.chatModel = createModel(model);
            initialized = true;
            log.info("[LLM] Langchain4j adapter initialized with model: {}", model);
        } catch (Exception e) {
            log.warn("[LLM] Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ChatModel createModel(String modelName) {
        AssistantProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("assistant.llm.langchain4j.api-key is not configured");
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .temperature(properties.getLlm().getTemperature())
                .maxTokens(properties.getLlm().getMaxTokens())
                .maxRetries(0) // retries are handled by our backoff
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new InferenceUnavailableException("Langchain4j adapter not available");
            }
            List<ChatMessage> messages = convertMessages(request.getMessages());

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return convertResponse(chatModel.chat(messages));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleepBeforeRetry(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new InferenceUnavailableException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new InferenceUnavailableException("LLM chat failed: max retries exhausted");
        });
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceUnavailableException("LLM chat interrupted during retry backoff", e);
        }
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        // One chunk carrying the full answer
        return Flux.create(sink -> chat(request).whenComplete((response, error) -> {
            if (error != null) {
                sink.error(error.getCause() != null ? error.getCause() : error);
            } else {
                sink.next(LlmChunk.builder()
                        .text(response.getContent())
                        .done(true)
                        .usage(response.getUsage())
                        .build());
                sink.complete();
            }
        }));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public List<String> getSupportedModels() {
        return currentModel != null ? List.of(currentModel) : List.of(properties.getLlm().getModel());
    }

    @Override
    public String getCurrentModel() {
        return currentModel;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getLangchain4j().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private List<ChatMessage> convertMessages(List<ContextMessage> context) {
        List<ChatMessage> messages = new ArrayList<>();
        for (ContextMessage msg : context) {
            String content = msg.content() != null ? msg.content() : "";
            switch (msg.role()) {
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            case Message.ROLE_ASSISTANT -> messages.add(AiMessage.from(content));
            // user turns and tool results, which are plain text here
            default -> messages.add(UserMessage.from(content));
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        LlmUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.builder()
                    .inputTokens(tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0)
                    .outputTokens(tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0)
                    .totalTokens(tokenUsage.totalTokenCount() != null ? tokenUsage.totalTokenCount() : 0)
                    .build();
        }
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(currentModel)
                .finishReason(response.finishReason() != null
                        ? response.finishReason().name().toLowerCase(Locale.ROOT)
                        : "stop")
                .usage(usage)
                .build();
    }
}
