package me.golemcore.assistant.adapter.inbound.web.controller;

import me.golemcore.assistant.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.assistant.adapter.inbound.web.dto.SessionInfoResponse;
import me.golemcore.assistant.domain.exception.SessionNotFoundException;
import me.golemcore.assistant.domain.model.ChatStats;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.testsupport.ChatFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionsControllerTest {

    private static final String SESSION_ID = "abcdef123456";

    private ChatFixture fixture;
    private SessionsController controller;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        fixture = new ChatFixture();
        controller = new SessionsController(fixture.sessions, fixture.exporter);
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler(fixture.properties))
                .build();
        fixture.sessions.createSession(SESSION_ID);
    }

    @Test
    void shouldReturnSessionWithLastFiveMessages() {
        for (int i = 1; i <= 6; i++) {
            fixture.sessions.addMessage(SESSION_ID, Message.ROLE_USER, "message " + i);
        }

        StepVerifier.create(controller.getSession(SESSION_ID))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    SessionInfoResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(SESSION_ID, body.getSession().getId());
                    assertEquals(7, body.getMessageCount());
                    assertEquals(List.of("message 2", "message 3", "message 4", "message 5", "message 6"),
                            body.getLastMessages().stream().map(Message::getContent).toList());
                })
                .verifyComplete();
    }

    @Test
    void shouldThrowForUnknownSession() {
        assertThrows(SessionNotFoundException.class, () -> controller.getSession("missing"));
    }

    @Test
    void shouldMapUnknownSessionToNotFound() {
        webTestClient.get()
                .uri("/api/v1/chat/sessions/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.message").isEqualTo("Session not found: missing");
    }

    @Test
    void shouldEndSessionOnce() {
        StepVerifier.create(controller.endSession(SESSION_ID))
                .assertNext(response -> assertEquals(Map.of("message", "Session ended successfully"),
                        response.getBody()))
                .verifyComplete();

        assertTrue(fixture.sessions.getSession(SESSION_ID).isEmpty());
        webTestClient.delete()
                .uri("/api/v1/chat/sessions/" + SESSION_ID)
                .exchange()
                .expectStatus().isNotFound();
    }

    // ==================== export ====================

    @Test
    void shouldExportJson() {
        fixture.sessions.addMessage(SESSION_ID, Message.ROLE_USER, "Hi");

        webTestClient.get()
                .uri("/api/v1/chat/sessions/" + SESSION_ID + "/export")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.session_id").isEqualTo(SESSION_ID)
                .jsonPath("$.created_at").exists()
                .jsonPath("$.messages.length()").isEqualTo(2)
                .jsonPath("$.messages[1].role").isEqualTo("user")
                .jsonPath("$.messages[1].content").isEqualTo("Hi");
    }

    @Test
    void shouldExportMarkdownAsAttachment() {
        fixture.sessions.addMessage(SESSION_ID, Message.ROLE_USER, "Hi");

        webTestClient.get()
                .uri("/api/v1/chat/sessions/" + SESSION_ID + "/export?format=markdown")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.parseMediaType("text/markdown"))
                .expectHeader().valueEquals(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=conversation_abcdef12.md")
                .expectBody(String.class)
                .value(body -> {
                    assertTrue(body.startsWith("# Conversation Export\n\n**Session ID:** " + SESSION_ID + "\n"));
                    assertTrue(body.contains("## User (10:00:00)\n\nHi\n\n"));
                });
    }

    @Test
    void shouldRejectUnsupportedExportFormat() {
        webTestClient.get()
                .uri("/api/v1/chat/sessions/" + SESSION_ID + "/export?format=pdf")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unsupported format");
    }

    @Test
    void shouldReturnStats() {
        fixture.sessions.createSession("second");
        fixture.sessions.addMessage(SESSION_ID, Message.ROLE_USER, "Hi");

        StepVerifier.create(controller.getStats())
                .assertNext(response -> {
                    ChatStats stats = response.getBody();
                    assertNotNull(stats);
                    assertEquals(2, stats.getActiveSessions());
                    assertEquals(2, stats.getTotalConversations());
                    assertEquals(3, stats.getTotalMessages());
                })
                .verifyComplete();
    }
}
