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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.DangerLevel;
import me.golemcore.assistant.domain.model.ToolCategory;
import me.golemcore.assistant.domain.model.ToolFailureKind;
import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolParameter;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.security.InjectionGuard;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single allow-listed command in the sandbox. Disabled unless
 * {@code assistant.tools.enable-system-commands} is set; the first word of the
 * command must be in {@code allowed-commands} and shell metacharacters that
 * chain, substitute or redirect are refused.
 */
@Component
@Lazy
@Slf4j
public class SystemCommandTool implements ToolComponent {

    private static final String PARAM_COMMAND = "command";
    private static final int MAX_OUTPUT_LENGTH = 100_000;

    private static final Set<String> ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME", "SYSTEMROOT", "COMSPEC");

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name("system_command")
            .description("Run an allow-listed system command in the sandbox directory")
            .category(ToolCategory.SYSTEM)
            .parameter(ToolParameter.string(PARAM_COMMAND, "Command line to execute"))
            .dangerLevel(DangerLevel.HIGH)
            .requiresConfirmation(true)
            .example("[TOOL: system_command(\"ls -la\")]")
            .build();

    private final AssistantProperties.ToolsProperties config;
    private final InjectionGuard injectionGuard;
    private final Path workDir;
    private final ExecutorService executor;

    public SystemCommandTool(AssistantProperties properties, InjectionGuard injectionGuard,
            SandboxFiles sandbox) {
        this.config = properties.getTools();
        this.injectionGuard = injectionGuard;
        this.workDir = sandbox.getSandboxRoot();
        this.executor = Executors.newCachedThreadPool();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Tools] System command executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnableSystemCommands();
    }

    @Override
    public CompletableFuture<ToolResult> execute(String sessionId, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String command = String.valueOf(parameters.get(PARAM_COMMAND)).trim();
            log.info("[Tools] system_command for session {}: '{}'", sessionId, truncate(command));

            String refusal = checkCommand(command);
            if (refusal != null) {
                log.warn("[Tools] system_command refused: {}", refusal);
                return ToolResult.failure(refusal);
            }
            return executeCommand(command, Math.max(1, config.getCommandTimeout()));
        }, executor);
    }

    /**
     * @return the refusal reason, or null when the command may run
     */
    String checkCommand(String command) {
        if (command.isEmpty()) {
            return "Empty command";
        }
        String program = command.split("\\s+", 2)[0];
        List<String> allowed = config.getAllowedCommands();
        if (allowed == null || !allowed.contains(program)) {
            return "Command not allowed: " + program;
        }
        if (injectionGuard.detectCommandInjection(command)) {
            return "Command injection detected";
        }
        return null;
    }

    private ToolResult executeCommand(String command, int timeoutSeconds) {
        ProcessBuilder pb = new ProcessBuilder();
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            pb.command("cmd.exe", "/c", command);
        } else {
            pb.command("/bin/sh", "-c", command);
        }
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        // keep only safe variables, drops LD_PRELOAD and friends
        Map<String, String> env = pb.environment();
        env.keySet().retainAll(ALLOWED_ENV_VARS);
        env.put("HOME", workDir.toString());
        env.put("PWD", workDir.toString());

        try {
            Process process = pb.start();
            Future<String> outputFuture = executor.submit(() -> readOutput(process));

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                process.destroyForcibly();
                return ToolResult.failure("Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            }

            int exitCode = process.exitValue();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("exit_code", exitCode);
            data.put(PARAM_COMMAND, command);

            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            return ToolResult.builder()
                    .success(false)
                    .output("Exit code: " + exitCode + "\n" + output)
                    .data(data)
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .error("Command failed with exit code " + exitCode)
                    .build();
        } catch (IOException e) {
            return ToolResult.failure("Failed to execute command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Command execution interrupted");
        } catch (ExecutionException e) {
            return ToolResult.failure("Error reading output: " + e.getMessage());
        }
    }

    private static String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        if (output.length() > MAX_OUTPUT_LENGTH) {
            output.setLength(MAX_OUTPUT_LENGTH);
            output.append("\n[Output truncated...]");
        }
        return output.toString();
    }

    private static String truncate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
