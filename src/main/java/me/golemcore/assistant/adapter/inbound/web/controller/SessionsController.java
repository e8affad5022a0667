package me.golemcore.assistant.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.adapter.inbound.web.dto.SessionInfoResponse;
import me.golemcore.assistant.domain.exception.ConversationNotFoundException;
import me.golemcore.assistant.domain.exception.SessionNotFoundException;
import me.golemcore.assistant.domain.model.ChatStats;
import me.golemcore.assistant.domain.model.Conversation;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.Session;
import me.golemcore.assistant.domain.service.ConversationExporter;
import me.golemcore.assistant.domain.service.SessionCoordinator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Session inspection, termination and conversation export.
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private static final int LAST_MESSAGES = 5;
    private static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown");

    private final SessionCoordinator sessionCoordinator;
    private final ConversationExporter conversationExporter;

    @GetMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<SessionInfoResponse>> getSession(@PathVariable String sessionId) {
        Session session = requireSession(sessionId);
        List<Message> messages = sessionCoordinator.getConversation(sessionId)
                .map(Conversation::getMessages)
                .orElse(List.of());
        List<Message> last = messages.subList(Math.max(0, messages.size() - LAST_MESSAGES), messages.size());
        SessionInfoResponse response = SessionInfoResponse.builder()
                .session(session)
                .messageCount(messages.size())
                .lastMessages(List.copyOf(last))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Map<String, String>>> endSession(@PathVariable String sessionId) {
        requireSession(sessionId);
        sessionCoordinator.endSession(sessionId);
        return Mono.just(ResponseEntity.ok(Map.of("message", "Session ended successfully")));
    }

    @GetMapping("/sessions/{sessionId}/export")
    public Mono<ResponseEntity<Object>> exportConversation(@PathVariable String sessionId,
            @RequestParam(defaultValue = "json") String format) {
        Session session = requireSession(sessionId);
        Conversation conversation = sessionCoordinator.getConversation(sessionId)
                .orElseThrow(() -> ConversationNotFoundException.forId(session.getConversationId()));

        if ("json".equals(format)) {
            return Mono.just(ResponseEntity.<Object>ok(conversationExporter.toJson(sessionId, conversation)));
        }
        if ("markdown".equals(format)) {
            String markdown = conversationExporter.toMarkdown(sessionId, conversation);
            return Mono.just(ResponseEntity.ok()
                    .contentType(TEXT_MARKDOWN)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename=" + ConversationExporter.fileName(sessionId))
                    .<Object>body(markdown));
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported format");
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<ChatStats>> getStats() {
        return Mono.just(ResponseEntity.ok(sessionCoordinator.getStats()));
    }

    private Session requireSession(String sessionId) {
        return sessionCoordinator.getSession(sessionId)
                .orElseThrow(() -> SessionNotFoundException.forId(sessionId));
    }
}
