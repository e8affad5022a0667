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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Component
@Lazy
@RequiredArgsConstructor
@Slf4j
public class WriteFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONTENT = "content";

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name("write_file")
            .description("Write text content to a file in the sandbox, replacing it if it exists")
            .category(ToolCategory.FILE_SYSTEM)
            .parameter(ToolParameter.string(PARAM_PATH, "File path relative to the sandbox"))
            .parameter(ToolParameter.string(PARAM_CONTENT, "Text to write"))
            .dangerLevel(DangerLevel.MEDIUM)
            .requiresConfirmation(true)
            .example("[TOOL: write_file(\"notes.txt\", \"Buy milk\")]")
            .build();

    private final SandboxFiles sandbox;

    @Override
    public ToolMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public CompletableFuture<ToolResult> execute(String sessionId, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String pathStr = String.valueOf(parameters.get(PARAM_PATH));
            Object content = parameters.get(PARAM_CONTENT);
            log.info("[FileSystem] write_file: {}", pathStr);

            Optional<Path> resolved = sandbox.resolve(pathStr);
            if (resolved.isEmpty() || sandbox.isRoot(resolved.get())) {
                return ToolResult.failure("Invalid path: must be within sandbox");
            }
            Path path = resolved.get();
            if (!sandbox.isExtensionAllowed(path.toString())) {
                return ToolResult.failure("File type not allowed: " + sandbox.relativePath(path));
            }
            if (Files.isDirectory(path)) {
                return ToolResult.failure("Not a file: " + sandbox.relativePath(path));
            }

            try {
                Path parent = path.getParent();
                if (parent != null && !Files.exists(parent)) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, content != null ? content.toString() : "", StandardCharsets.UTF_8);
                long size = Files.size(path);
                return ToolResult.success("Successfully written to file: " + sandbox.relativePath(path), Map.of(
                        PARAM_PATH, sandbox.relativePath(path),
                        "size", size));
            } catch (IOException e) {
                return ToolResult.failure("Failed to write file: " + e.getMessage());
            }
        });
    }
}
