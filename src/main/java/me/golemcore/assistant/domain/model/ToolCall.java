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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured invocation request parsed out of model text, or submitted by a
 * client for confirmed execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    private String id;

    @JsonProperty("tool_name")
    private String toolName;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    @JsonProperty("requires_confirmation")
    private boolean requiresConfirmation;

    /**
     * Record embedded into assistant message metadata.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", id);
        record.put("tool_name", toolName);
        record.put("parameters", parameters != null ? new LinkedHashMap<>(parameters) : Map.of());
        record.put("requires_confirmation", requiresConfirmation);
        return record;
    }
}
