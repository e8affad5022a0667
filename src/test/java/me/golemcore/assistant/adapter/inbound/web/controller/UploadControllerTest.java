package me.golemcore.assistant.adapter.inbound.web.controller;

import me.golemcore.assistant.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.assistant.domain.exception.PayloadTooLargeException;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.testsupport.ChatFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UploadControllerTest {

    private static final String SESSION_ID = "upload-session";

    private ChatFixture fixture;
    private UploadController controller;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        fixture = new ChatFixture();
        controller = new UploadController(fixture.orchestrator, fixture.properties);
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler(fixture.properties))
                .build();
        fixture.sessions.createSession(SESSION_ID);
    }

    private static MultipartBodyBuilder multipart(String filename, byte[] content) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", content).filename(filename).contentType(MediaType.APPLICATION_OCTET_STREAM);
        return builder;
    }

    @Test
    void shouldUploadThroughFileUploadTool() {
        byte[] content = "hello upload".getBytes(StandardCharsets.UTF_8);

        webTestClient.post()
                .uri("/api/v1/chat/upload?session_id=" + SESSION_ID)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("notes.txt", content).build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.file.saved_as").isEqualTo("1234abcd_a.txt");

        List<Map<String, Object>> invocations = fixture.upload.getInvocations();
        assertEquals(1, invocations.size());
        assertEquals("notes.txt", invocations.get(0).get("filename"));
        assertEquals(Base64.getEncoder().encodeToString(content), invocations.get(0).get("content"));
        assertEquals(content.length, invocations.get(0).get("size"));

        List<Message> messages = fixture.sessions.getConversation(SESSION_ID).orElseThrow().getMessages();
        assertEquals("File uploaded: notes.txt -> 1234abcd_a.txt", messages.get(messages.size() - 1).getContent());
    }

    @Test
    void shouldRejectOversizedFile() {
        fixture.properties.getTools().setMaxFileSizeMb(1);
        byte[] content = new byte[3 * 512 * 1024];

        webTestClient.post()
                .uri("/api/v1/chat/upload?session_id=" + SESSION_ID)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("big.bin", content).build()))
                .exchange()
                .expectStatus().isEqualTo(413)
                .expectBody()
                .jsonPath("$.message").isEqualTo("File too large: 1.5MB (max: 1MB)");

        assertTrue(fixture.upload.getInvocations().isEmpty());
    }

    @Test
    void shouldCountOversizedStreamWithoutBufferingIt() {
        fixture.properties.getTools().setMaxFileSizeMb(1);
        byte[] chunk = new byte[1024 * 1024];
        FilePart part = mock(FilePart.class);
        when(part.filename()).thenReturn("huge.bin");
        when(part.content()).thenReturn(Flux.range(0, 2048)
                .<DataBuffer>map(i -> DefaultDataBufferFactory.sharedInstance.wrap(chunk)));

        StepVerifier.create(controller.upload(SESSION_ID, part))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(PayloadTooLargeException.class, error);
                    assertEquals("File too large: 2048.0MB (max: 1MB)", error.getMessage());
                })
                .verify();

        assertTrue(fixture.upload.getInvocations().isEmpty());
    }

    @Test
    void shouldAcceptFileExactlyAtLimit() {
        fixture.properties.getTools().setMaxFileSizeMb(1);
        byte[] half = new byte[512 * 1024];
        FilePart part = mock(FilePart.class);
        when(part.filename()).thenReturn("edge.bin");
        when(part.content()).thenReturn(Flux.<DataBuffer>just(
                DefaultDataBufferFactory.sharedInstance.wrap(half),
                DefaultDataBufferFactory.sharedInstance.wrap(half)));

        StepVerifier.create(controller.upload(SESSION_ID, part))
                .assertNext(response -> assertEquals(200, response.getStatusCode().value()))
                .verifyComplete();

        assertEquals(1024 * 1024, fixture.upload.getInvocations().get(0).get("size"));
    }

    @Test
    void shouldRequireExistingSession() {
        webTestClient.post()
                .uri("/api/v1/chat/upload?session_id=ghost")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("notes.txt", new byte[] { 1 }).build()))
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void shouldRejectBlankFilename() {
        FilePart part = mock(FilePart.class);
        when(part.filename()).thenReturn(" ");

        StepVerifier.create(controller.upload(SESSION_ID, part))
                .expectErrorSatisfies(error -> {
                    ResponseStatusException status = assertInstanceOf(ResponseStatusException.class, error);
                    assertEquals(400, status.getStatusCode().value());
                    assertEquals("No filename provided", status.getReason());
                })
                .verify();
    }
}
