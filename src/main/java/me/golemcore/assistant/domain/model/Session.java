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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Caller-visible handle to one ongoing interaction. Owns exactly one
 * {@link Conversation} referenced by {@code conversationId}.
 *
 * <p>
 * Live instances are shared between request threads and the expiry sweep.
 * {@code messageCount} and {@code active} are only written while holding the
 * owning conversation's monitor; {@code lastActivity} may be refreshed by plain
 * reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    @JsonProperty("session_id")
    private String id;

    @JsonProperty("conversation_id")
    private String conversationId;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("last_activity")
    private volatile Instant lastActivity;

    @JsonProperty("message_count")
    private volatile int messageCount;

    @Builder.Default
    private volatile boolean active = true;

    /**
     * Detached copy safe to hand out to callers.
     */
    public Session snapshot() {
        return Session.builder()
                .id(id)
                .conversationId(conversationId)
                .createdAt(createdAt)
                .lastActivity(lastActivity)
                .messageCount(messageCount)
                .active(active)
                .build();
    }
}
