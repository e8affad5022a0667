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
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.exception.AssistantException;
import me.golemcore.assistant.domain.exception.ToolConfirmationRequiredException;
import me.golemcore.assistant.domain.exception.ToolDisabledException;
import me.golemcore.assistant.domain.exception.ToolExecutionException;
import me.golemcore.assistant.domain.exception.ToolNotFoundException;
import me.golemcore.assistant.domain.exception.ToolValidationException;
import me.golemcore.assistant.domain.model.ToolCall;
import me.golemcore.assistant.domain.model.ToolFailureKind;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.security.SecurityAuditLogger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Failure boundary between tool code and the rest of the service.
 *
 * <p>
 * Gates are applied in order: unknown tool, missing confirmation, disabled
 * tool. Only then is the tool body invoked. Whatever the tool throws or however
 * its future completes, the caller receives a {@link ToolResult}; nothing
 * propagates. Every execution is attributed to a session in the audit log.
 */
@Service
@Slf4j
public class ToolExecutor {

    private final ToolRegistry toolRegistry;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final AssistantProperties properties;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;

    public ToolExecutor(ToolRegistry toolRegistry, ToolConfirmationPolicy confirmationPolicy,
            AssistantProperties properties, SecurityAuditLogger auditLogger, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.confirmationPolicy = confirmationPolicy;
        this.properties = properties;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * @return an error message, or empty when the call is acceptable
     */
    public Optional<String> validate(ToolCall toolCall) {
        Optional<ToolComponent> tool = toolRegistry.get(toolCall.getToolName());
        if (tool.isEmpty()) {
            return Optional.of("Unknown tool: " + toolCall.getToolName());
        }
        return tool.get().validate(toolCall.getParameters());
    }

    public CompletableFuture<ToolResult> execute(String sessionId, ToolCall toolCall, boolean confirmed) {
        String toolName = toolCall.getToolName();
        auditLogger.toolCall(sessionId, toolName, confirmed);

        Optional<ToolComponent> found = toolRegistry.get(toolName);
        if (found.isEmpty()) {
            log.warn("[Tools] Tool not found: {}", toolName);
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.NOT_FOUND, "Tool not found: " + toolName));
        }
        if (confirmationPolicy.requiresConfirmation(toolName) && !confirmed) {
            log.info("[Tools] Confirmation required for {}: {}", toolName,
                    confirmationPolicy.describeAction(toolCall));
            return CompletableFuture.completedFuture(ToolResult.confirmationRequired());
        }
        ToolComponent tool = found.get();
        if (!tool.isEnabled()) {
            log.info("[Tools] Tool {} is disabled", toolName);
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.DISABLED, toolName + " is disabled"));
        }

        long started = clock.millis();
        Map<String, Object> parameters = toolCall.getParameters() != null ? toolCall.getParameters() : Map.of();
        CompletableFuture<ToolResult> invocation;
        try {
            invocation = tool.execute(sessionId, parameters);
        } catch (RuntimeException e) {
            invocation = CompletableFuture.failedFuture(e);
        }
        if (invocation == null) {
            invocation = CompletableFuture.failedFuture(new IllegalStateException("Tool returned no result"));
        }

        return invocation
                .orTimeout(properties.getTools().getExecutionTimeoutSeconds(), TimeUnit.SECONDS)
                .handle((result, error) -> {
                    ToolResult outcome = error != null ? failureOf(toolName, error) : nonNull(result);
                    outcome.setExecutionTimeMs(clock.millis() - started);
                    auditLogger.toolResult(sessionId, toolName, outcome.isSuccess(), outcome.getExecutionTimeMs());
                    log.debug("[Tools] {} finished in {}ms, success={}", toolName, outcome.getExecutionTimeMs(),
                            outcome.isSuccess());
                    return outcome;
                });
    }

    /**
     * Exception matching a failed result, for callers that surface failures as
     * errors instead of results.
     */
    public static AssistantException toException(String toolName, ToolResult result) {
        ToolFailureKind kind = result.getFailureKind() != null ? result.getFailureKind()
                : ToolFailureKind.EXECUTION_FAILED;
        String error = result.getError() != null ? result.getError() : "Tool execution failed";
        return switch (kind) {
        case NOT_FOUND -> ToolNotFoundException.forName(toolName);
        case VALIDATION_FAILED -> new ToolValidationException(error);
        case CONFIRMATION_REQUIRED -> new ToolConfirmationRequiredException(error);
        case DISABLED -> new ToolDisabledException(error);
        case EXECUTION_FAILED -> new ToolExecutionException(error);
        };
    }

    private static ToolResult nonNull(ToolResult result) {
        return result != null ? result : ToolResult.failure("Tool returned no result");
    }

    private static ToolResult failureOf(String toolName, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            log.error("[Tools] Tool {} timed out", toolName);
            return ToolResult.failure("Tool execution timed out");
        }
        log.error("[Tools] Tool execution failed: {}", toolName, cause);
        return ToolResult.failure(safeMessage(cause));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String safeMessage(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
