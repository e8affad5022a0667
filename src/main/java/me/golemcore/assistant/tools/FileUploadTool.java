package me.golemcore.assistant.tools;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.DangerLevel;
import me.golemcore.assistant.domain.model.ToolCategory;
import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolParameter;
import me.golemcore.assistant.domain.model.ToolResult;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Stores base64 content in the sandbox under a collision-free name
 * {@code <uuid8>_<sanitized original>}.
 */
@Component
@Lazy
@RequiredArgsConstructor
@Slf4j
public class FileUploadTool implements ToolComponent {

    private static final String PARAM_FILENAME = "filename";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_SIZE = "size";

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name("file_upload")
            .description("Store an uploaded file in the sandbox")
            .category(ToolCategory.FILE_SYSTEM)
            .parameter(ToolParameter.string(PARAM_FILENAME, "Original file name"))
            .parameter(ToolParameter.string(PARAM_CONTENT, "File content, base64 encoded"))
            .parameter(ToolParameter.builder()
                    .name(PARAM_SIZE)
                    .type(ToolParameter.TYPE_INTEGER)
                    .description("Declared size in bytes")
                    .required(false)
                    .build())
            .dangerLevel(DangerLevel.LOW)
            .requiresConfirmation(false)
            .build();

    private final SandboxFiles sandbox;

    @Override
    public ToolMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public CompletableFuture<ToolResult> execute(String sessionId, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String original = String.valueOf(parameters.get(PARAM_FILENAME));
            String safeName = sanitize(original);
            if (safeName.isEmpty()) {
                return ToolResult.failure("Invalid file name: " + original);
            }
            if (!sandbox.isExtensionAllowed(safeName)) {
                return ToolResult.failure("File type not allowed: " + original);
            }

            byte[] bytes;
            try {
                bytes = Base64.getDecoder().decode(String.valueOf(parameters.get(PARAM_CONTENT)));
            } catch (IllegalArgumentException e) {
                return ToolResult.failure("Invalid base64 content");
            }
            if (bytes.length > sandbox.getMaxFileSizeBytes()) {
                return ToolResult.failure("File too large (max " + sandbox.getMaxFileSizeMb() + " MB)");
            }

            String savedAs = UUID.randomUUID().toString().substring(0, 8) + "_" + safeName;
            Path target = sandbox.getSandboxRoot().resolve(savedAs);
            try {
                Files.write(target, bytes);
            } catch (IOException e) {
                return ToolResult.failure("Failed to store file: " + e.getMessage());
            }
            log.info("[FileSystem] Stored upload {} as {} ({} bytes)", original, savedAs, bytes.length);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("original_name", original);
            data.put("saved_as", savedAs);
            data.put(PARAM_SIZE, bytes.length);
            data.put("path", sandbox.relativePath(target));
            return ToolResult.success("File uploaded: " + original + " -> " + savedAs, data);
        });
    }

    /**
     * Keeps only the last path segment and replaces unsafe characters.
     */
    static String sanitize(String filename) {
        if (filename == null) {
            return "";
        }
        String normalized = filename.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        String cleaned = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.matches("\\.*") ? "" : cleaned;
    }
}
