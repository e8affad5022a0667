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

import me.golemcore.assistant.domain.model.ToolCall;
import me.golemcore.assistant.domain.model.ToolMetadata;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Single authority on whether a tool invocation needs explicit user
 * confirmation. Consulted both when tool calls are parsed out of model text and
 * when they are executed, so the two can never disagree.
 *
 * <p>
 * A tool needs confirmation when its name is in {@link #ALWAYS_CONFIRM} or when
 * its registered metadata declares it. The static set applies even when the tool
 * is not registered.
 */
@Component
public class ToolConfirmationPolicy {

    public static final Set<String> ALWAYS_CONFIRM = Set.of("write_file", "delete_file", "system_command");

    private static final int MAX_ARG_PREVIEW = 80;

    private final ToolRegistry toolRegistry;

    public ToolConfirmationPolicy(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    public boolean requiresConfirmation(String toolName) {
        if (toolName == null) {
            return false;
        }
        if (ALWAYS_CONFIRM.contains(toolName)) {
            return true;
        }
        return toolRegistry.getMetadata(toolName)
                .map(ToolMetadata::isRequiresConfirmation)
                .orElse(false);
    }

    public boolean requiresConfirmation(ToolCall toolCall) {
        return toolCall != null && requiresConfirmation(toolCall.getToolName());
    }

    /**
     * Human-readable one-liner for confirmation prompts and audit logs.
     */
    public String describeAction(ToolCall toolCall) {
        Map<String, Object> params = toolCall.getParameters() != null ? toolCall.getParameters() : Map.of();
        return switch (toolCall.getToolName()) {
        case "write_file" -> "Write file: " + params.getOrDefault("path", "?");
        case "delete_file" -> "Delete: " + params.getOrDefault("path", "?");
        case "system_command" -> "Run command: " + truncate(String.valueOf(params.getOrDefault("command", "?")));
        default -> toolCall.getToolName() + ": " + truncate(params.toString());
        };
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_ARG_PREVIEW) {
            return text;
        }
        return text.substring(0, MAX_ARG_PREVIEW) + "...";
    }
}
