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
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Declared description of a tool: identity, schema and the confirmation policy
 * it asks for. Registered once at startup and read-only afterwards.
 */
@Value
@Builder
public class ToolMetadata {

    String name;
    String description;
    ToolCategory category;

    @Singular
    List<ToolParameter> parameters;

    @JsonProperty("danger_level")
    @Builder.Default
    DangerLevel dangerLevel = DangerLevel.SAFE;

    @JsonProperty("requires_confirmation")
    boolean requiresConfirmation;

    @Singular
    List<String> examples;

    /**
     * Signature in the form {@code name(p: type, q: type)}.
     */
    public String signature() {
        String params = parameters.stream()
                .map(p -> p.getName() + ": " + p.getType())
                .collect(Collectors.joining(", "));
        return name + "(" + params + ")";
    }
}
