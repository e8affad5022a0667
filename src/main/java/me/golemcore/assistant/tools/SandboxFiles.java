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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.security.InjectionGuard;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

/**
 * Path containment for the file tools. Every path a tool touches is resolved
 * against the sandbox root and must stay inside it, also after following
 * symlinks.
 */
@Component
@Slf4j
public class SandboxFiles {

    private final Path sandboxRoot;
    private final InjectionGuard injectionGuard;
    private final AssistantProperties.ToolsProperties config;

    public SandboxFiles(AssistantProperties properties, InjectionGuard injectionGuard) {
        this.config = properties.getTools();
        this.sandboxRoot = Paths.get(config.getSandboxPath()).toAbsolutePath().normalize();
        this.injectionGuard = injectionGuard;

        try {
            Files.createDirectories(sandboxRoot);
        } catch (IOException e) {
            log.error("[FileSystem] Failed to create sandbox directory: {}", sandboxRoot, e);
        }
    }

    /**
     * Resolves a sandbox-relative path. A blank path is the sandbox root.
     *
     * @return the resolved path, or empty when it would leave the sandbox
     */
    public Optional<Path> resolve(String pathStr) {
        String relative = pathStr == null || pathStr.isBlank() ? "." : pathStr.trim();
        if (injectionGuard.detectPathTraversal(relative)) {
            log.warn("[FileSystem] Path traversal attempt BLOCKED: {}", relative);
            return Optional.empty();
        }
        try {
            Path resolved = sandboxRoot.resolve(relative).normalize();
            if (!resolved.startsWith(sandboxRoot)) {
                log.warn("[FileSystem] Path outside sandbox BLOCKED: {}", relative);
                return Optional.empty();
            }

            // a path that does not exist yet is checked through its nearest existing ancestor
            Path existing = resolved;
            while (existing != null && !Files.exists(existing)) {
                if (Files.isSymbolicLink(existing)) {
                    log.warn("[FileSystem] Dangling symlink blocked: {}", relative);
                    return Optional.empty();
                }
                existing = existing.getParent();
            }
            if (existing == null) {
                return Optional.empty();
            }
            Path realPath = existing.toRealPath();
            if (!realPath.startsWith(sandboxRoot.toRealPath())) {
                log.warn("[FileSystem] Symlink escape blocked: {} -> {}", resolved, realPath);
                return Optional.empty();
            }
            return Optional.of(resolved);
        } catch (InvalidPathException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("[FileSystem] Failed to resolve real path: {}", relative);
            return Optional.empty();
        }
    }

    public String relativePath(Path path) {
        String relative = sandboxRoot.relativize(path).toString();
        return relative.isEmpty() ? "." : relative;
    }

    public boolean isRoot(Path path) {
        return sandboxRoot.equals(path);
    }

    public boolean isExtensionAllowed(String filename) {
        return config.isExtensionAllowed(filename);
    }

    public long getMaxFileSizeBytes() {
        return config.getMaxFileSizeBytes();
    }

    public int getMaxFileSizeMb() {
        return config.getMaxFileSizeMb();
    }

    public Path getSandboxRoot() {
        return sandboxRoot;
    }

    static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
