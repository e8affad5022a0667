package me.golemcore.assistant.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Typed event of a streamed chat turn: one {@code session}, zero or more
 * {@code content}, at most one {@code tool_calls}, then exactly one
 * {@code done} (or {@code error}).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEvent {

    public enum Type {
        SESSION, CONTENT, TOOL_CALLS, DONE, ERROR;

        @JsonValue
        public String getId() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    Type type;

    @JsonProperty("session_id")
    String sessionId;

    String content;

    @JsonProperty("tool_calls")
    List<ToolCall> toolCalls;

    ChatTurnState state;

    String error;

    public static ChatEvent session(String sessionId) {
        return ChatEvent.builder().type(Type.SESSION).sessionId(sessionId).build();
    }

    public static ChatEvent content(String text) {
        return ChatEvent.builder().type(Type.CONTENT).content(text).build();
    }

    public static ChatEvent toolCalls(List<ToolCall> calls) {
        return ChatEvent.builder().type(Type.TOOL_CALLS).toolCalls(calls).build();
    }

    public static ChatEvent done(ChatTurnState state) {
        return ChatEvent.builder().type(Type.DONE).state(state).build();
    }

    public static ChatEvent error(String message) {
        return ChatEvent.builder().type(Type.ERROR).error(message).build();
    }
}
