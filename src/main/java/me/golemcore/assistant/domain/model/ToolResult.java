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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a tool invocation: success flag, human-readable output, optional
 * structured data, error text and execution duration. Turned into a tool-role
 * message by the orchestrator; never retained on its own.
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    public static final String META_REQUIRES_CONFIRMATION = "requires_confirmation";

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;

    @JsonProperty("failure_kind")
    private ToolFailureKind failureKind;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    /**
     * Refusal returned when a confirmation-gated tool is invoked unconfirmed.
     */
    public static ToolResult confirmationRequired() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_REQUIRES_CONFIRMATION, true);
        return ToolResult.builder()
                .success(false)
                .failureKind(ToolFailureKind.CONFIRMATION_REQUIRED)
                .error("Tool requires user confirmation")
                .metadata(metadata)
                .build();
    }

    @JsonIgnore
    public boolean isConfirmationRequired() {
        return metadata != null && Boolean.TRUE.equals(metadata.get(META_REQUIRES_CONFIRMATION));
    }

    /**
     * Record stored in tool message metadata.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("success", success);
        record.put("output", output);
        if (data != null) {
            record.put("data", data);
        }
        record.put("error", error);
        record.put("execution_time_ms", executionTimeMs);
        return record;
    }
}
