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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.exception.AssistantException;
import me.golemcore.assistant.domain.exception.InferenceUnavailableException;
import me.golemcore.assistant.domain.exception.PayloadTooLargeException;
import me.golemcore.assistant.domain.exception.SessionNotFoundException;
import me.golemcore.assistant.domain.exception.ToolNotFoundException;
import me.golemcore.assistant.domain.exception.ToolValidationException;
import me.golemcore.assistant.domain.model.ChatEvent;
import me.golemcore.assistant.domain.model.ChatTurnResult;
import me.golemcore.assistant.domain.model.ChatTurnState;
import me.golemcore.assistant.domain.model.ContextMessage;
import me.golemcore.assistant.domain.model.LlmChunk;
import me.golemcore.assistant.domain.model.LlmRequest;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.Session;
import me.golemcore.assistant.domain.model.ToolCall;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.port.outbound.LlmPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one chat turn through its states: resolve the session, append the
 * user message, fetch the context window, call inference, parse tool calls,
 * append the assistant message, then finish in {@code DONE} or
 * {@code TOOLS_PENDING} when a call needs confirmation.
 *
 * <p>
 * An assistant message is appended only once the full answer is known. A
 * failed or cancelled inference leaves the user message recorded and appends
 * nothing else.
 */
@Service
@Slf4j
public class ChatOrchestrator {

    static final String TOOL_UPLOAD = "file_upload";

    private final SessionCoordinator sessionCoordinator;
    private final ResponseParser responseParser;
    private final ToolExecutor toolExecutor;
    private final ToolRegistry toolRegistry;
    private final LlmPort llmPort;
    private final AssistantProperties properties;

    public ChatOrchestrator(SessionCoordinator sessionCoordinator, ResponseParser responseParser,
            ToolExecutor toolExecutor, ToolRegistry toolRegistry, LlmPort llmPort,
            AssistantProperties properties) {
        this.sessionCoordinator = sessionCoordinator;
        this.responseParser = responseParser;
        this.toolExecutor = toolExecutor;
        this.toolRegistry = toolRegistry;
        this.llmPort = llmPort;
        this.properties = properties;
    }

    // ==================== chat turns ====================

    /**
     * Runs a blocking turn and returns the assistant message with its parsed tool
     * calls.
     */
    public Mono<ChatTurnResult> sendMessage(String sessionId, String content) {
        return Mono.defer(() -> {
            Turn turn = new Turn();
            LlmRequest request = prepare(turn, sessionId, content, false);
            turn.advance(ChatTurnState.INFERENCE_CALLED);
            return Mono.fromFuture(() -> llmPort.chat(request))
                    .onErrorMap(error -> !(error instanceof AssistantException), ChatOrchestrator::inferenceFailure)
                    .map(response -> complete(turn, response.getContent()));
        });
    }

    /**
     * Runs a streaming turn: {@code session}, then every {@code content} fragment
     * as it arrives, then {@code tool_calls} if any, then {@code done}. A failure
     * ends the stream with an {@code error} event instead of {@code done}.
     */
    public Flux<ChatEvent> streamMessage(String sessionId, String content) {
        Turn turn = new Turn();
        return Flux.defer(() -> {
            LlmRequest request = prepare(turn, sessionId, content, true);
            turn.advance(ChatTurnState.INFERENCE_CALLED);
            StringBuilder answer = new StringBuilder();

            Flux<ChatEvent> fragments = Flux.defer(() -> llmPort.chatStream(request))
                    .map(LlmChunk::getText)
                    .filter(text -> text != null && !text.isEmpty())
                    .doOnNext(answer::append)
                    .map(ChatEvent::content)
                    .onErrorMap(error -> !(error instanceof AssistantException), ChatOrchestrator::inferenceFailure);

            Flux<ChatEvent> completion = Flux.defer(() -> {
                ChatTurnResult result = complete(turn, answer.toString());
                List<ChatEvent> events = new ArrayList<>();
                if (!result.getToolCalls().isEmpty()) {
                    events.add(ChatEvent.toolCalls(result.getToolCalls()));
                }
                events.add(ChatEvent.done(result.getState()));
                return Flux.fromIterable(events);
            });

            return Flux.concat(Flux.just(ChatEvent.session(turn.sessionId)), fragments, completion);
        })
                .onErrorResume(error -> {
                    log.warn("[Chat] Streaming turn failed for session {} in state {}: {}",
                            turn.sessionId, turn.state, error.getMessage());
                    return Flux.just(ChatEvent.error(describe(error)));
                })
                .doOnCancel(() -> log.info("[Chat] Stream cancelled for session {} in state {}, nothing persisted",
                        turn.sessionId, turn.state));
    }

    private LlmRequest prepare(Turn turn, String sessionId, String content, boolean stream) {
        Session session = sessionCoordinator.getOrCreateSession(sessionId);
        turn.sessionId = session.getId();
        turn.advance(ChatTurnState.SESSION_RESOLVED);

        sessionCoordinator.addMessage(session.getId(), Message.ROLE_USER, content);
        turn.advance(ChatTurnState.USER_APPENDED);

        List<ContextMessage> context = withToolsDescription(
                sessionCoordinator.getContext(session.getId(), properties.getChat().getContextWindow()));
        turn.advance(ChatTurnState.CONTEXT_FETCHED);
        log.debug("[Chat] Session {}: {} context messages", session.getId(), context.size());

        return LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .messages(context)
                .temperature(properties.getLlm().getTemperature())
                .maxTokens(properties.getLlm().getMaxTokens())
                .stream(stream)
                .sessionId(session.getId())
                .build();
    }

    private ChatTurnResult complete(Turn turn, String answer) {
        String text = answer != null ? answer : "";
        List<ToolCall> toolCalls = responseParser.parse(text);
        turn.advance(ChatTurnState.RESPONSE_PARSED);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool_calls", toolCalls.stream().map(ToolCall::toMetadata).toList());
        Message message = sessionCoordinator.addMessage(turn.sessionId, Message.ROLE_ASSISTANT, text, metadata);
        turn.advance(ChatTurnState.ASSISTANT_APPENDED);

        boolean requiresConfirmation = toolCalls.stream().anyMatch(ToolCall::isRequiresConfirmation);
        turn.advance(requiresConfirmation ? ChatTurnState.TOOLS_PENDING : ChatTurnState.DONE);
        if (!toolCalls.isEmpty()) {
            log.info("[Chat] Session {}: {} tool call(s), state {}", turn.sessionId, toolCalls.size(), turn.state);
        }

        return ChatTurnResult.builder()
                .sessionId(turn.sessionId)
                .message(message)
                .toolCalls(toolCalls)
                .requiresConfirmation(requiresConfirmation)
                .state(turn.state)
                .build();
    }

    /**
     * Appends the tool catalogue to the first system message, or prepends a
     * system message when the window no longer holds one.
     */
    private List<ContextMessage> withToolsDescription(List<ContextMessage> context) {
        String description = toolRegistry.getToolsDescription();
        List<ContextMessage> messages = new ArrayList<>(context);
        for (int i = 0; i < messages.size(); i++) {
            ContextMessage message = messages.get(i);
            if (Message.ROLE_SYSTEM.equals(message.role())) {
                messages.set(i, message.withContent(message.content() + "\n\n" + description));
                return messages;
            }
        }
        messages.add(0, new ContextMessage(Message.ROLE_SYSTEM, description));
        return messages;
    }

    // ==================== tools ====================

    /**
     * Executes a tool call on behalf of a session. A successful result is
     * appended to the conversation as a tool message.
     *
     * @throws ToolNotFoundException
     *             if the tool is unknown
     * @throws ToolValidationException
     *             if the parameters do not match the tool's schema
     * @throws SessionNotFoundException
     *             if the session is unknown
     */
    public Mono<ToolResult> executeTool(String sessionId, ToolCall toolCall, boolean confirmed) {
        return Mono.defer(() -> {
            String toolName = toolCall.getToolName();
            if (toolRegistry.get(toolName).isEmpty()) {
                throw ToolNotFoundException.forName(toolName);
            }
            toolExecutor.validate(toolCall).ifPresent(error -> {
                throw new ToolValidationException(error);
            });
            Session session = sessionCoordinator.getSession(sessionId)
                    .orElseThrow(() -> SessionNotFoundException.forId(sessionId));

            return Mono.fromFuture(() -> toolExecutor.execute(session.getId(), toolCall, confirmed))
                    .doOnNext(result -> {
                        if (result.isSuccess()) {
                            Map<String, Object> metadata = new LinkedHashMap<>();
                            metadata.put("tool_result", result.toMetadata());
                            sessionCoordinator.addMessage(session.getId(), Message.ROLE_TOOL,
                                    "Tool: " + toolName + "\nResult: " + result.getOutput(), metadata);
                        }
                    });
        });
    }

    /**
     * Stores an uploaded file in the sandbox and records it in the conversation.
     *
     * @throws PayloadTooLargeException
     *             if the file exceeds the configured size limit
     */
    public Mono<ToolResult> uploadFile(String sessionId, String filename, byte[] content) {
        return Mono.defer(() -> {
            long maxBytes = properties.getTools().getMaxFileSizeBytes();
            if (content.length > maxBytes) {
                throw PayloadTooLargeException.forFileSize(content.length, properties.getTools().getMaxFileSizeMb());
            }
            Session session = sessionCoordinator.getSession(sessionId)
                    .orElseThrow(() -> SessionNotFoundException.forId(sessionId));

            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("filename", filename);
            parameters.put("content", Base64.getEncoder().encodeToString(content));
            parameters.put("size", content.length);
            ToolCall upload = ToolCall.builder()
                    .id(TOOL_UPLOAD + "_0")
                    .toolName(TOOL_UPLOAD)
                    .parameters(parameters)
                    .build();

            return Mono.fromFuture(() -> toolExecutor.execute(session.getId(), upload, true))
                    .map(result -> {
                        if (!result.isSuccess()) {
                            throw ToolExecutor.toException(TOOL_UPLOAD, result);
                        }
                        Map<String, Object> metadata = new LinkedHashMap<>();
                        metadata.put("file_upload", result.getData());
                        Object stored = result.getData() instanceof Map<?, ?> data ? data.get("saved_as") : null;
                        sessionCoordinator.addMessage(session.getId(), Message.ROLE_SYSTEM,
                                "File uploaded: " + filename + " -> " + stored, metadata);
                        log.info("[Chat] Session {}: uploaded {} ({} bytes)", session.getId(), filename,
                                content.length);
                        return result;
                    });
        });
    }

    // ==================== internals ====================

    private static Throwable inferenceFailure(Throwable error) {
        log.error("[Chat] Inference failed: {}", error.getMessage());
        return new InferenceUnavailableException("Inference backend unavailable: " + error.getMessage(), error);
    }

    private String describe(Throwable error) {
        if (error instanceof AssistantException || properties.isDebug()) {
            return error.getMessage();
        }
        log.error("[Chat] Unexpected streaming failure", error);
        return "Internal server error";
    }

    /**
     * Per-turn progress. Confined to the turn's reactive chain.
     */
    private static final class Turn {

        private ChatTurnState state = ChatTurnState.IDLE;
        private String sessionId;

        private void advance(ChatTurnState next) {
            state = state.advanceTo(next);
        }
    }
}
