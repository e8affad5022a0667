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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Single entry of a conversation. Messages are immutable once appended; the
 * metadata map is copied into an unmodifiable view by the session layer before
 * the message is stored.
 */
@Value
@Builder
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private static final Set<String> ROLES = Set.of(ROLE_SYSTEM, ROLE_USER, ROLE_ASSISTANT, ROLE_TOOL);

    String id;
    String role;
    String content;
    Instant timestamp;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public static boolean isKnownRole(String role) {
        return role != null && ROLES.contains(role);
    }

    @JsonIgnore
    public boolean hasRole(String expected) {
        return expected.equals(role);
    }

    /**
     * Projects this message into the {role, content} shape sent to inference.
     */
    public ContextMessage toContext() {
        return new ContextMessage(role, content);
    }
}
