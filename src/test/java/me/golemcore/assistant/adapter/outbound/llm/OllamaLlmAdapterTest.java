package me.golemcore.assistant.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.assistant.domain.exception.InferenceUnavailableException;
import me.golemcore.assistant.domain.model.ContextMessage;
import me.golemcore.assistant.domain.model.LlmRequest;
import me.golemcore.assistant.domain.model.LlmResponse;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.infrastructure.http.FeignClientFactory;
import me.golemcore.assistant.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OllamaLlmAdapterTest {

    private static final String TAGS_JSON = """
            {"models": [
              {"name": "mistral:latest", "size": 4109865159, "digest": "abc", "details": {"family": "llama"}},
              {"name": "llama3", "size": 1}
            ]}
            """;

    private OkHttpMockEngine engine;
    private AssistantProperties properties;
    private ObjectMapper objectMapper;
    private OllamaLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new AssistantProperties();
        properties.getLlm().getOllama().setBaseUrl("http://ollama.test:11434/");
        objectMapper = new ObjectMapper();
        adapter = new OllamaLlmAdapter(properties, new FeignClientFactory(engine.client(), objectMapper),
                objectMapper);
    }

    private static LlmRequest request() {
        return LlmRequest.builder()
                .messages(List.of(
                        new ContextMessage("system", "Be brief."),
                        new ContextMessage("user", "Hi")))
                .temperature(0.2)
                .maxTokens(64)
                .build();
    }

    // ==================== startup probe ====================

    @Test
    void shouldKeepConfiguredModelWhenAvailable() {
        engine.enqueueJson(200, TAGS_JSON);

        adapter.initialize();

        assertEquals("mistral:latest", adapter.getCurrentModel());
        assertEquals(List.of("mistral:latest", "llama3"), adapter.getSupportedModels());
        assertEquals("/api/tags", engine.takeRequest().target());
    }

    @Test
    void shouldSurviveUnreachableBackend() {
        engine.enqueueFailure(new IOException("Connection refused"));

        adapter.initialize();

        assertEquals("mistral:latest", adapter.getCurrentModel());
        assertTrue(adapter.getSupportedModels().isEmpty());
    }

    @Test
    void shouldResolveModelFallbacks() {
        assertEquals("mistral:latest", OllamaLlmAdapter.resolveModel("mistral:latest", List.of("mistral:latest")));
        assertEquals("mistral", OllamaLlmAdapter.resolveModel("mistral:latest", List.of("llama3", "mistral")));
        assertEquals("llama3", OllamaLlmAdapter.resolveModel("mistral:latest", List.of("llama3", "phi3")));
        assertEquals("mistral:latest", OllamaLlmAdapter.resolveModel("mistral:latest", List.of()));
    }

    // ==================== chat ====================

    @Test
    void shouldSendChatRequestAndMapResponse() throws Exception {
        engine.enqueueJson(200, TAGS_JSON);
        engine.enqueueJson(200, """
                {"model": "mistral:latest", "message": {"role": "assistant", "content": "Hello!"},
                 "done": true, "done_reason": "stop", "prompt_eval_count": 12, "eval_count": 3,
                 "total_duration": 123456}
                """);

        LlmResponse response = adapter.chat(request()).get(5, TimeUnit.SECONDS);

        assertEquals("Hello!", response.getContent());
        assertEquals("stop", response.getFinishReason());
        assertEquals(15, response.getUsage().getTotalTokens());

        engine.takeRequest();
        OkHttpMockEngine.CapturedRequest chat = engine.takeRequest();
        assertEquals("POST", chat.method());
        assertEquals("/api/chat", chat.target());
        JsonNode body = objectMapper.readTree(chat.body());
        assertEquals("mistral:latest", body.get("model").asText());
        assertFalse(body.get("stream").asBoolean());
        assertEquals(2, body.get("messages").size());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals(0.2, body.get("options").get("temperature").asDouble());
        assertEquals(64, body.get("options").get("num_predict").asInt());
    }

    @Test
    void shouldFailWhenBackendErrors() {
        engine.enqueueJson(200, TAGS_JSON);
        engine.enqueueJson(500, "{\"error\": \"model crashed\"}");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request()).get(5, TimeUnit.SECONDS));

        assertInstanceOf(InferenceUnavailableException.class, error.getCause());
    }

    @Test
    void shouldFailOnErrorPayload() {
        engine.enqueueJson(200, TAGS_JSON);
        engine.enqueueJson(200, "{\"error\": \"model 'x' not found\"}");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request()).get(5, TimeUnit.SECONDS));

        assertEquals("Ollama error: model 'x' not found", error.getCause().getMessage());
    }

    // ==================== streaming ====================

    @Test
    void shouldStreamFragments() throws Exception {
        engine.enqueueJson(200, TAGS_JSON);
        engine.enqueueNdjson(200,
                "{\"message\": {\"role\": \"assistant\", \"content\": \"Hel\"}, \"done\": false}",
                "",
                "{\"message\": {\"role\": \"assistant\", \"content\": \"lo\"}, \"done\": false}",
                "{\"message\": {\"role\": \"assistant\", \"content\": \"\"}, \"done\": true, \"eval_count\": 2}");

        StepVerifier.create(adapter.chatStream(request()))
                .assertNext(chunk -> assertEquals("Hel", chunk.getText()))
                .assertNext(chunk -> assertEquals("lo", chunk.getText()))
                .assertNext(chunk -> {
                    assertTrue(chunk.isDone());
                    assertEquals(2, chunk.getUsage().getOutputTokens());
                })
                .expectComplete()
                .verify(java.time.Duration.ofSeconds(5));

        engine.takeRequest();
        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertTrue(body.get("stream").asBoolean());
    }

    @Test
    void shouldFailStreamOnHttpError() {
        engine.enqueueJson(200, TAGS_JSON);
        engine.enqueueJson(404, "{\"error\": \"not found\"}");

        StepVerifier.create(adapter.chatStream(request()))
                .expectErrorMatches(error -> error instanceof InferenceUnavailableException
                        && "Ollama returned status 404".equals(error.getMessage()))
                .verify(java.time.Duration.ofSeconds(5));
    }

    @Test
    void shouldFailStreamWhenUnreachable() {
        engine.enqueueJson(200, TAGS_JSON);
        engine.enqueueFailure(new IOException("Connection reset"));

        StepVerifier.create(adapter.chatStream(request()))
                .expectError(InferenceUnavailableException.class)
                .verify(java.time.Duration.ofSeconds(5));
    }

    // ==================== health ====================

    @Test
    void shouldProbeAvailability() {
        engine.enqueueJson(200, TAGS_JSON);
        engine.enqueueFailure(new IOException("down"));

        assertTrue(adapter.isAvailable());
        assertFalse(adapter.isAvailable());
        assertTrue(adapter.supportsStreaming());
        assertEquals("ollama", adapter.getProviderId());
    }
}
