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
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Deletes a file or an empty directory. Non-empty directories are refused.
 */
@Component
@Lazy
@RequiredArgsConstructor
@Slf4j
public class DeleteFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name("delete_file")
            .description("Delete a file or an empty directory in the sandbox")
            .category(ToolCategory.FILE_SYSTEM)
            .parameter(ToolParameter.string(PARAM_PATH, "Path relative to the sandbox"))
            .dangerLevel(DangerLevel.HIGH)
            .requiresConfirmation(true)
            .example("[TOOL: delete_file(\"old_notes.txt\")]")
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
            log.info("[FileSystem] delete_file: {}", pathStr);

            Optional<Path> resolved = sandbox.resolve(pathStr);
            if (resolved.isEmpty() || sandbox.isRoot(resolved.get())) {
                return ToolResult.failure("Invalid path: must be within sandbox");
            }
            Path path = resolved.get();
            if (!Files.exists(path)) {
                return ToolResult.failure("Path not found: " + sandbox.relativePath(path));
            }

            try {
                Files.delete(path);
                return ToolResult.success("Deleted: " + sandbox.relativePath(path),
                        Map.of(PARAM_PATH, sandbox.relativePath(path)));
            } catch (DirectoryNotEmptyException e) {
                return ToolResult.failure("Directory not empty: " + sandbox.relativePath(path));
            } catch (IOException e) {
                return ToolResult.failure("Failed to delete: " + e.getMessage());
            }
        });
    }
}
