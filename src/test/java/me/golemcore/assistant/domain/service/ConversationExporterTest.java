package me.golemcore.assistant.domain.service;

import me.golemcore.assistant.domain.model.Conversation;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConversationExporterTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:15:30Z");

    private ConversationExporter exporter;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        exporter = new ConversationExporter(new MutableClock(CREATED, ZoneOffset.UTC));
        conversation = new Conversation("conv-1", CREATED);
        conversation.append(Message.builder().id("1").role(Message.ROLE_SYSTEM).content("Be helpful.")
                .timestamp(CREATED).build());
        conversation.append(Message.builder().id("2").role(Message.ROLE_USER).content("Hi")
                .timestamp(CREATED.plusSeconds(5)).build());
        conversation.append(Message.builder().id("3").role(Message.ROLE_ASSISTANT).content("Hello!")
                .timestamp(CREATED.plusSeconds(7)).build());
    }

    @Test
    void shouldExportStructuredData() {
        Map<String, Object> export = exporter.toJson("session-123", conversation);

        assertEquals("session-123", export.get("session_id"));
        assertEquals(CREATED, export.get("created_at"));
        assertEquals(3, ((List<?>) export.get("messages")).size());
    }

    @Test
    void shouldRenderMarkdownTranscript() {
        String markdown = exporter.toMarkdown("session-123", conversation);

        assertEquals("""
                # Conversation Export

                **Session ID:** session-123
                **Date:** 2026-03-01 10:15:30

                ## System (10:15:30)

                Be helpful.

                ## User (10:15:35)

                Hi

                ## Assistant (10:15:37)

                Hello!

                """, markdown);
    }

    @Test
    void shouldRenderTimesInClockZone() {
        ConversationExporter shifted = new ConversationExporter(new MutableClock(CREATED, ZoneOffset.ofHours(3)));

        String markdown = shifted.toMarkdown("s", conversation);

        assertTrue(markdown.contains("**Date:** 2026-03-01 13:15:30"));
        assertTrue(markdown.contains("## User (13:15:35)"));
    }

    @Test
    void shouldBuildFileNameFromSessionPrefix() {
        assertEquals("conversation_abcdef12.md", ConversationExporter.fileName("abcdef12-3456-7890"));
        assertEquals("conversation_short.md", ConversationExporter.fileName("short"));
    }
}
