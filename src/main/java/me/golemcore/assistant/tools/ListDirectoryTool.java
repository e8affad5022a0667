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
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

@Component
@Lazy
@RequiredArgsConstructor
@Slf4j
public class ListDirectoryTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final int MAX_FILES_LIST = 100;

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name("list_directory")
            .description("List files and directories in the sandbox")
            .category(ToolCategory.FILE_SYSTEM)
            .parameter(ToolParameter.builder()
                    .name(PARAM_PATH)
                    .description("Directory path relative to the sandbox (default: sandbox root)")
                    .required(false)
                    .build())
            .dangerLevel(DangerLevel.SAFE)
            .requiresConfirmation(false)
            .example("[TOOL: list_directory(\".\")]")
            .build();

    private final SandboxFiles sandbox;

    @Override
    public ToolMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public CompletableFuture<ToolResult> execute(String sessionId, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathParam = parameters.get(PARAM_PATH);
            String pathStr = pathParam != null ? pathParam.toString() : ".";
            log.info("[FileSystem] list_directory: {}", pathStr);

            Optional<Path> resolved = sandbox.resolve(pathStr);
            if (resolved.isEmpty()) {
                return ToolResult.failure("Invalid path: must be within sandbox");
            }
            Path path = resolved.get();
            if (!Files.exists(path)) {
                return ToolResult.failure("Directory not found: " + sandbox.relativePath(path));
            }
            if (!Files.isDirectory(path)) {
                return ToolResult.failure("Not a directory: " + sandbox.relativePath(path));
            }

            try (Stream<Path> stream = Files.list(path)) {
                List<Map<String, Object>> entries = stream
                        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .limit(MAX_FILES_LIST)
                        .map(this::describe)
                        .toList();

                StringBuilder sb = new StringBuilder();
                sb.append("Directory: ").append(sandbox.relativePath(path)).append('\n');
                sb.append("Entries: ").append(entries.size()).append("\n\n");
                for (Map<String, Object> entry : entries) {
                    if ("directory".equals(entry.get("type"))) {
                        sb.append("[DIR]  ").append(entry.get("name")).append("/\n");
                    } else {
                        sb.append("[FILE] ").append(entry.get("name"))
                                .append(" (").append(SandboxFiles.formatSize((long) entry.get("size"))).append(")\n");
                    }
                }
                return ToolResult.success(sb.toString(), Map.of(
                        PARAM_PATH, sandbox.relativePath(path),
                        "entries", entries));
            } catch (IOException e) {
                return ToolResult.failure("Failed to list directory: " + e.getMessage());
            }
        });
    }

    private Map<String, Object> describe(Path entry) {
        String name = entry.getFileName().toString();
        try {
            BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class);
            return Map.of(
                    "name", name,
                    "type", attrs.isDirectory() ? "directory" : "file",
                    "size", attrs.size(),
                    "modified", attrs.lastModifiedTime().toString());
        } catch (IOException e) {
            return Map.of("name", name, "type", "file", "size", 0L);
        }
    }
}
