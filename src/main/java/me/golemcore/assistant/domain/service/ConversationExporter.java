package me.golemcore.assistant.domain.service;

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

import me.golemcore.assistant.domain.model.Conversation;
import me.golemcore.assistant.domain.model.Message;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a conversation snapshot as structured data or as a Markdown
 * transcript. Times are shown in the service's clock zone.
 */
@Component
public class ConversationExporter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;

    public ConversationExporter(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Object> toJson(String sessionId, Conversation conversation) {
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("session_id", sessionId);
        export.put("created_at", conversation.getCreatedAt());
        export.put("messages", conversation.getMessages());
        return export;
    }

    public String toMarkdown(String sessionId, Conversation conversation) {
        StringBuilder markdown = new StringBuilder("# Conversation Export\n\n");
        markdown.append("**Session ID:** ").append(sessionId).append('\n');
        markdown.append("**Date:** ")
                .append(DATE.format(ZonedDateTime.ofInstant(conversation.getCreatedAt(), clock.getZone())))
                .append("\n\n");
        for (Message message : conversation.getMessages()) {
            markdown.append("## ").append(capitalize(message.getRole()))
                    .append(" (").append(TIME.format(ZonedDateTime.ofInstant(message.getTimestamp(), clock.getZone())))
                    .append(")\n\n")
                    .append(message.getContent()).append("\n\n");
        }
        return markdown.toString();
    }

    public static String fileName(String sessionId) {
        String prefix = sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
        return "conversation_" + prefix + ".md";
    }

    private static String capitalize(String role) {
        if (role == null || role.isEmpty()) {
            return "";
        }
        return role.substring(0, 1).toUpperCase(Locale.ROOT) + role.substring(1);
    }
}
