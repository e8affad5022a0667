package me.golemcore.assistant.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import me.golemcore.assistant.testsupport.http.OkHttpMockEngine;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeignClientFactoryTest {

    interface EchoApi {
        @RequestLine("GET /echo/{name}")
        Map<String, Object> echo(@Param("name") String name);
    }

    private OkHttpMockEngine engine;
    private FeignClientFactory factory;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        factory = new FeignClientFactory(engine.client(), new ObjectMapper());
    }

    @Test
    void shouldDecodeJsonThroughSharedClient() {
        engine.enqueueJson(200, "{\"name\":\"golem\"}");

        Map<String, Object> result = factory.create(EchoApi.class, "http://backend.local/").echo("golem");

        assertEquals("golem", result.get("name"));
        assertEquals("/echo/golem", engine.takeRequest().target());
    }

    @Test
    void shouldNotRetryFailedCalls() {
        engine.enqueueJson(503, "{}");

        EchoApi api = factory.create(EchoApi.class, "http://backend.local", 1000, 1000);

        FeignException error = assertThrows(FeignException.class, () -> api.echo("x"));
        assertEquals(503, error.status());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldRunRawCallsOnSharedPool() throws IOException {
        engine.enqueueNdjson(200, "{\"a\":1}");

        try (Response response = factory.newCall(new Request.Builder().url("http://backend.local/stream").build())
                .execute()) {
            assertEquals(200, response.code());
            assertEquals("{\"a\":1}\n", response.body().string());
        }
    }

    @Test
    void shouldNormalizeBaseUrl() {
        assertEquals("http://localhost:11434", FeignClientFactory.normalize(" http://localhost:11434/ "));
        assertEquals("https://api.search.brave.com", FeignClientFactory.normalize("https://api.search.brave.com"));
        assertThrows(IllegalArgumentException.class, () -> FeignClientFactory.normalize(" "));
    }
}
