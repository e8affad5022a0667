package me.golemcore.assistant.domain.component;

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

import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolParameter;
import me.golemcore.assistant.domain.model.ToolResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Capability contract every tool implements: declared metadata, parameter
 * validation and an execution entry point. Tools are Spring beans, so adding
 * one never touches the orchestrator.
 */
public interface ToolComponent {

    /**
     * Returns the declared metadata: name, category, parameter schema, danger
     * level, confirmation requirement and usage examples.
     *
     * @return the tool metadata
     */
    ToolMetadata getMetadata();

    /**
     * Executes the tool on behalf of a session.
     *
     * @param sessionId
     *            session the execution is attributed to
     * @param parameters
     *            named parameters, already validated
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(String sessionId, Map<String, Object> parameters);

    /**
     * Checks the parameters against the declared schema: required parameters must
     * be present and non-blank, and typed parameters must be convertible.
     *
     * @return an error message, or empty when the parameters are acceptable
     */
    default Optional<String> validate(Map<String, Object> parameters) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        for (ToolParameter parameter : getMetadata().getParameters()) {
            Object value = params.get(parameter.getName());
            if (value == null || (value instanceof String s && s.isBlank())) {
                if (parameter.isRequired()) {
                    return Optional.of("Missing required parameter: " + parameter.getName());
                }
                continue;
            }
            if (!isOfType(value, parameter.getType())) {
                return Optional.of("Parameter '" + parameter.getName() + "' must be of type " + parameter.getType());
            }
        }
        return Optional.empty();
    }

    /**
     * Administrative switch; disabled tools are refused by the executor.
     */
    default boolean isEnabled() {
        return true;
    }

    default String getToolName() {
        return getMetadata().getName();
    }

    private static boolean isOfType(Object value, String type) {
        if (type == null) {
            return true;
        }
        return switch (type) {
        case ToolParameter.TYPE_INTEGER -> value instanceof Number
                || (value instanceof String s && s.trim().matches("-?\\d+"));
        case ToolParameter.TYPE_BOOLEAN -> value instanceof Boolean
                || (value instanceof String s && ("true".equalsIgnoreCase(s.trim())
                        || "false".equalsIgnoreCase(s.trim())));
        default -> true;
        };
    }
}
