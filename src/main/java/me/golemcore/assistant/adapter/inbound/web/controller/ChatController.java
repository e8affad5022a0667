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
import me.golemcore.assistant.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.assistant.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.assistant.domain.model.ChatEvent;
import me.golemcore.assistant.domain.model.ChatTurnResult;
import me.golemcore.assistant.domain.service.ChatOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Chat turn endpoints: blocking and server-sent-events streaming.
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatOrchestrator chatOrchestrator;

    @PostMapping("/message")
    public Mono<ResponseEntity<ChatResponse>> sendMessage(@RequestBody ChatRequest request) {
        requireMessage(request);
        return chatOrchestrator.sendMessage(request.getSessionId(), request.getMessage())
                .map(result -> ResponseEntity.ok(toResponse(result)));
    }

    @PostMapping(value = "/message/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ChatEvent>> streamMessage(@RequestBody ChatRequest request) {
        requireMessage(request);
        return chatOrchestrator.streamMessage(request.getSessionId(), request.getMessage())
                .map(event -> ServerSentEvent.<ChatEvent>builder()
                        .event(event.getType().getId())
                        .data(event)
                        .build());
    }

    private static void requireMessage(ChatRequest request) {
        if (request == null || request.getMessage() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
    }

    private static ChatResponse toResponse(ChatTurnResult result) {
        return ChatResponse.builder()
                .sessionId(result.getSessionId())
                .message(result.getMessage())
                .toolCalls(result.getToolCalls())
                .requiresConfirmation(result.isRequiresConfirmation())
                .state(result.getState())
                .build();
    }
}
