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
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only message history behind a session. The first message is
 * always the system primer.
 *
 * <p>
 * Instances are not thread-safe on their own: every mutation and every read of
 * the live history happens while holding this object's monitor. Callers outside
 * the session layer only ever see {@link #snapshot()} copies.
 */
@Getter
public class Conversation {

    private final String id;

    @JsonProperty("created_at")
    private final Instant createdAt;

    private final List<Message> messages;

    public Conversation(String id, Instant createdAt) {
        this(id, createdAt, new ArrayList<>());
    }

    private Conversation(String id, Instant createdAt, List<Message> messages) {
        this.id = id;
        this.createdAt = createdAt;
        this.messages = messages;
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void append(Message message) {
        messages.add(message);
    }

    public int size() {
        return messages.size();
    }

    /**
     * Drops the oldest messages after the primer until at most {@code maxLength}
     * remain. Returns the number of dropped messages.
     */
    public int trimTo(int maxLength) {
        int dropped = 0;
        int floor = Math.max(maxLength, 1);
        while (messages.size() > floor && messages.size() > 1) {
            messages.remove(1);
            dropped++;
        }
        return dropped;
    }

    /**
     * Returns the last {@code maxMessages} entries, oldest first.
     */
    public List<ContextMessage> getContext(int maxMessages) {
        if (maxMessages <= 0) {
            return List.of();
        }
        int from = Math.max(0, messages.size() - maxMessages);
        List<ContextMessage> context = new ArrayList<>(messages.size() - from);
        for (Message message : messages.subList(from, messages.size())) {
            context.add(message.toContext());
        }
        return context;
    }

    public Conversation snapshot() {
        return new Conversation(id, createdAt, List.copyOf(messages));
    }
}
