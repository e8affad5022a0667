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
import me.golemcore.assistant.domain.exception.ConversationNotFoundException;
import me.golemcore.assistant.domain.exception.SessionNotFoundException;
import me.golemcore.assistant.domain.model.ChatStats;
import me.golemcore.assistant.domain.model.ContextMessage;
import me.golemcore.assistant.domain.model.Conversation;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.Session;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.security.SecurityAuditLogger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Session lifecycle and conversation history: creation, lookup, termination,
 * serialized message append, context windowing and idle expiry.
 *
 * <p>
 * Concurrency: every mutation of a conversation, and every removal of its
 * session, happens while holding the conversation's monitor. Appends to one
 * conversation are therefore serialized in call order, while different sessions
 * never contend. An append that loses the race against termination observes the
 * session as no longer live and fails with {@link SessionNotFoundException}.
 */
@Service
@Slf4j
public class SessionCoordinator {

    private final ConversationStore store;
    private final AssistantProperties properties;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;

    public SessionCoordinator(ConversationStore store, AssistantProperties properties,
            SecurityAuditLogger auditLogger, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    // ==================== lifecycle ====================

    /**
     * Creates a session with a fresh conversation seeded with the system primer. A
     * live session with the same id is ended and replaced.
     */
    public Session createSession(String sessionId) {
        Session session = newSession(resolveId(sessionId));
        Optional<Session> replaced = store.put(session, conversationOf(session));
        replaced.ifPresent(previous -> {
            log.warn("[Session] Replacing existing session: {}", previous.getId());
            retire(previous);
        });
        log.info("[Session] Created new session: {}", session.getId());
        return session;
    }

    /**
     * Returns the live session for {@code sessionId}, creating it when absent.
     * Resolution is atomic: concurrent first turns with the same id share one
     * session.
     */
    public Session getOrCreateSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return createSession(null);
        }
        boolean[] created = new boolean[1];
        Session session = store.computeIfAbsent(sessionId, id -> {
            created[0] = true;
            Session fresh = newSession(id);
            store.putConversation(conversationOf(fresh));
            return fresh;
        });
        if (created[0]) {
            log.info("[Session] Created new session: {}", session.getId());
        } else {
            touch(session);
        }
        return session;
    }

    /**
     * Looks up a session. A hit counts as activity.
     */
    public Optional<Session> getSession(String sessionId) {
        Optional<Session> session = store.findSession(sessionId);
        session.ifPresent(this::touch);
        return session;
    }

    /**
     * Ends a session and drops its conversation. Idempotent: ending an unknown or
     * already ended session is a no-op.
     *
     * @return true if this call ended the session
     */
    public boolean endSession(String sessionId) {
        Optional<Session> session = store.findSession(sessionId);
        if (session.isEmpty()) {
            log.debug("[Session] End requested for unknown session: {}", sessionId);
            return false;
        }
        boolean ended = terminate(session.get());
        if (ended) {
            log.info("[Session] Ended session: {}", sessionId);
            auditLogger.sessionEnded(sessionId, "explicit");
        }
        return ended;
    }

    // ==================== history ====================

    /**
     * Appends a message to the session's conversation.
     *
     * @throws SessionNotFoundException
     *             if the session is unknown or was ended concurrently
     * @throws ConversationNotFoundException
     *             if a live session has lost its conversation
     */
    public Message addMessage(String sessionId, String role, String content, Map<String, Object> metadata) {
        if (!Message.isKnownRole(role)) {
            throw new IllegalArgumentException("Unknown message role: " + role);
        }
        Session session = store.findSession(sessionId)
                .orElseThrow(() -> SessionNotFoundException.forId(sessionId));
        Conversation conversation = store.findConversation(session.getConversationId())
                .orElseThrow(() -> {
                    log.error("[Session] Session {} has no conversation {}", sessionId, session.getConversationId());
                    return ConversationNotFoundException.forId(session.getConversationId());
                });

        Message message;
        synchronized (conversation) {
            if (!store.isLive(session)) {
                throw SessionNotFoundException.forId(sessionId);
            }
            message = Message.builder()
                    .id(UUID.randomUUID().toString())
                    .role(role)
                    .content(content != null ? content : "")
                    .timestamp(Instant.now(clock))
                    .metadata(freeze(metadata))
                    .build();
            conversation.append(message);
            int dropped = conversation.trimTo(properties.getChat().getMaxConversationLength());
            if (dropped > 0) {
                log.debug("[Session] Trimmed {} old messages from {}", dropped, conversation.getId());
            }
            session.setMessageCount(session.getMessageCount() + 1);
            session.setLastActivity(message.getTimestamp());
        }

        auditLogger.messageAdded(sessionId, conversation.getId(), role, message.getContent().length());
        return message;
    }

    public Message addMessage(String sessionId, String role, String content) {
        return addMessage(sessionId, role, content, null);
    }

    /**
     * Returns at most {@code maxMessages} of the most recent messages, oldest
     * first, or an empty list when the session is unknown.
     */
    public List<ContextMessage> getContext(String sessionId, int maxMessages) {
        Optional<Session> session = getSession(sessionId);
        if (session.isEmpty()) {
            return List.of();
        }
        Optional<Conversation> conversation = store.findConversation(session.get().getConversationId());
        if (conversation.isEmpty()) {
            return List.of();
        }
        synchronized (conversation.get()) {
            return conversation.get().getContext(maxMessages);
        }
    }

    /**
     * Read-only snapshot of the session's conversation.
     */
    public Optional<Conversation> getConversation(String sessionId) {
        return getSession(sessionId)
                .flatMap(session -> store.findConversation(session.getConversationId()))
                .map(conversation -> {
                    synchronized (conversation) {
                        return conversation.snapshot();
                    }
                });
    }

    public List<Session> listSessions() {
        return store.sessions().stream()
                .map(Session::snapshot)
                .toList();
    }

    public ChatStats getStats() {
        long totalMessages = 0;
        for (Conversation conversation : store.conversations()) {
            synchronized (conversation) {
                totalMessages += conversation.size();
            }
        }
        return ChatStats.builder()
                .activeSessions(store.sessionCount())
                .totalConversations(store.conversationCount())
                .totalMessages(totalMessages)
                .build();
    }

    // ==================== expiry ====================

    /**
     * Ends every session idle for longer than the configured timeout. A failure on
     * one session is logged and does not stop the sweep.
     *
     * @return number of sessions ended
     */
    public int sweepExpired() {
        Duration timeout = Duration.ofMinutes(properties.getChat().getSessionTimeoutMinutes());
        int expired = 0;
        for (Session session : store.sessions()) {
            try {
                if (expireIfIdle(session, timeout)) {
                    expired++;
                    log.info("[Session] Cleaned up expired session: {}", session.getId());
                    auditLogger.sessionEnded(session.getId(), "idle timeout");
                }
            } catch (RuntimeException e) {
                log.error("[Session] Failed to expire session {}", session.getId(), e);
            }
        }
        return expired;
    }

    private boolean expireIfIdle(Session session, Duration timeout) {
        if (!isIdle(session, timeout)) {
            return false;
        }
        Optional<Conversation> conversation = store.findConversation(session.getConversationId());
        if (conversation.isEmpty()) {
            return store.remove(session);
        }
        synchronized (conversation.get()) {
            // re-check under the lock: an append may have refreshed activity
            if (!isIdle(session, timeout)) {
                return false;
            }
            return removeLocked(session);
        }
    }

    private boolean isIdle(Session session, Duration timeout) {
        Instant lastActivity = session.getLastActivity();
        return lastActivity != null && Duration.between(lastActivity, Instant.now(clock)).compareTo(timeout) > 0;
    }

    // ==================== internals ====================

    private boolean terminate(Session session) {
        Optional<Conversation> conversation = store.findConversation(session.getConversationId());
        if (conversation.isEmpty()) {
            session.setActive(false);
            return store.remove(session);
        }
        synchronized (conversation.get()) {
            return removeLocked(session);
        }
    }

    private boolean removeLocked(Session session) {
        boolean removed = store.remove(session);
        if (removed) {
            session.setActive(false);
        }
        return removed;
    }

    private void retire(Session previous) {
        Optional<Conversation> conversation = store.findConversation(previous.getConversationId());
        if (conversation.isPresent()) {
            synchronized (conversation.get()) {
                previous.setActive(false);
                store.dropConversation(previous.getConversationId());
            }
        } else {
            previous.setActive(false);
        }
    }

    private void touch(Session session) {
        session.setLastActivity(Instant.now(clock));
    }

    private Session newSession(String sessionId) {
        Instant now = Instant.now(clock);
        return Session.builder()
                .id(sessionId)
                .conversationId(UUID.randomUUID().toString())
                .createdAt(now)
                .lastActivity(now)
                .messageCount(0)
                .active(true)
                .build();
    }

    private Conversation conversationOf(Session session) {
        Conversation conversation = new Conversation(session.getConversationId(), session.getCreatedAt());
        conversation.append(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_SYSTEM)
                .content(properties.getChat().getSystemPrimer())
                .timestamp(session.getCreatedAt())
                .build());
        return conversation;
    }

    private static String resolveId(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
    }

    private static Map<String, Object> freeze(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
