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
import me.golemcore.assistant.domain.model.Session;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Memory-resident tables of live sessions and their conversations. Holds no
 * policy: lifecycle, locking and expiry belong to {@link SessionCoordinator}.
 *
 * <p>
 * A conversation is registered before the session that points at it and removed
 * together with it, so every live session resolves to a conversation.
 */
@Component
public class ConversationStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    public Optional<Session> findSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<Conversation> findConversation(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(conversations.get(conversationId));
    }

    /**
     * Registers a session and its conversation, replacing any session with the
     * same id. Returns the replaced session, if any.
     */
    public Optional<Session> put(Session session, Conversation conversation) {
        conversations.put(conversation.getId(), conversation);
        return Optional.ofNullable(sessions.put(session.getId(), session));
    }

    /**
     * Atomically returns the live session for {@code sessionId} or registers the
     * one produced by {@code factory}. The factory is responsible for registering
     * the conversation through {@link #putConversation(Conversation)}.
     */
    public Session computeIfAbsent(String sessionId, Function<String, Session> factory) {
        return sessions.computeIfAbsent(sessionId, factory);
    }

    public void putConversation(Conversation conversation) {
        conversations.put(conversation.getId(), conversation);
    }

    /**
     * Removes the session only if it is still the registered instance, then drops
     * its conversation.
     *
     * @return true if this call removed the session
     */
    public boolean remove(Session session) {
        boolean removed = sessions.remove(session.getId(), session);
        if (removed) {
            conversations.remove(session.getConversationId());
        }
        return removed;
    }

    public void dropConversation(String conversationId) {
        conversations.remove(conversationId);
    }

    public boolean isLive(Session session) {
        return sessions.get(session.getId()) == session;
    }

    public Collection<Session> sessions() {
        return List.copyOf(sessions.values());
    }

    public Collection<Conversation> conversations() {
        return List.copyOf(conversations.values());
    }

    public int sessionCount() {
        return sessions.size();
    }

    public int conversationCount() {
        return conversations.size();
    }
}
