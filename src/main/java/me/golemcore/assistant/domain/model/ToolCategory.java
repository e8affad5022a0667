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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tool grouping. The declaration order is the order used when describing the
 * catalogue to the model.
 */
public enum ToolCategory {

    FILE_SYSTEM("file_system"), WEB("web"), SYSTEM("system"), UTILITY("utility");

    private final String id;

    ToolCategory(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static ToolCategory fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Tool category is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ToolCategory category : values()) {
            if (category.id.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown tool category: " + value);
    }
}
