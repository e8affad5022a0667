package me.golemcore.assistant.security;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Writes security audit records to the dedicated {@code security.audit} logger.
 * The acting session, the action and the touched resource travel in the MDC so
 * the Logback pattern can lay them out as columns.
 */
@Component
public class SecurityAuditLogger {

    public static final String LOGGER_NAME = "security.audit";
    static final String MDC_USER = "user";
    static final String MDC_ACTION = "action";
    static final String MDC_RESOURCE = "resource";

    private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

    public void messageAdded(String sessionId, String conversationId, String role, int length) {
        record(sessionId, "message_added", "conversation:" + conversationId,
                "Message added: role=" + role + ", length=" + length);
    }

    public void toolCall(String sessionId, String toolName, boolean confirmed) {
        record(sessionId, "tool_call", toolName, "Tool call requested: " + toolName + ", confirmed=" + confirmed);
    }

    public void toolResult(String sessionId, String toolName, boolean success, long durationMs) {
        record(sessionId, "tool_result", toolName,
                "Tool finished: " + toolName + ", success=" + success + ", duration=" + durationMs + "ms");
    }

    public void sessionEnded(String sessionId, String reason) {
        record(sessionId, "session_ended", "session:" + sessionId, "Session ended: " + reason);
    }

    private void record(String user, String action, String resource, String message) {
        try (MDC.MDCCloseable u = MDC.putCloseable(MDC_USER, user);
                MDC.MDCCloseable a = MDC.putCloseable(MDC_ACTION, action);
                MDC.MDCCloseable r = MDC.putCloseable(MDC_RESOURCE, resource)) {
            AUDIT.info(message);
        }
    }
}
