package me.golemcore.assistant.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Centralized configuration properties for the assistant, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code assistant.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - inference backend selection and sampling</li>
 * <li>{@link HttpProperties} - shared OkHttp client timeouts</li>
 * <li>{@link ChatProperties} - session timeout, sweep and context window</li>
 * <li>{@link ToolsProperties} - sandbox, file limits and command policy</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "assistant")
@Data
public class AssistantProperties {

    private String version = "0.1.0";
    private boolean debug = false;
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private ChatProperties chat = new ChatProperties();
    private ToolsProperties tools = new ToolsProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "ollama";
        private String model = "mistral:latest";
        private double temperature = 0.7;
        private int maxTokens = 2048;
        private OllamaProperties ollama = new OllamaProperties();
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class OllamaProperties {
        private String baseUrl = "http://localhost:11434";
    }

    @Data
    public static class Langchain4jProperties {
        private String apiKey;
        private String baseUrl;
        private long timeoutMs = 120000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== CHAT ====================

    @Data
    public static class ChatProperties {
        private int sessionTimeoutMinutes = 60;
        private long sweepIntervalSeconds = 300;
        private int contextWindow = 10;
        private int maxConversationLength = 100;
        private String systemPrimer = "You are a helpful AI assistant with access to various tools. "
                + "You can browse the web, read and write files, and execute system commands. "
                + "Always ask for confirmation before performing potentially dangerous operations.";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private String sandboxPath = "./sandbox";
        private int maxFileSizeMb = 10;
        private List<String> allowedFileExtensions = new ArrayList<>(List.of(
                ".txt", ".md", ".json", ".csv", ".log", ".py", ".js", ".html", ".css"));
        private boolean enableSystemCommands = false;
        private int commandTimeout = 30;
        private int executionTimeoutSeconds = 60;
        private List<String> allowedCommands = new ArrayList<>(List.of(
                "dir", "ls", "echo", "cat", "type", "find", "grep"));
        private WebSearchProperties webSearch = new WebSearchProperties();

        public long getMaxFileSizeBytes() {
            return (long) maxFileSizeMb * 1024 * 1024;
        }

        /**
         * Extension check, case-insensitive. An empty allow-list permits every
         * extension.
         */
        public boolean isExtensionAllowed(String filename) {
            if (allowedFileExtensions == null || allowedFileExtensions.isEmpty()) {
                return true;
            }
            String lower = filename.toLowerCase(Locale.ROOT);
            return allowedFileExtensions.stream()
                    .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                    .anyMatch(lower::endsWith);
        }
    }

    @Data
    public static class WebSearchProperties {
        private boolean enabled = false;
        private String apiKey;
        private String baseUrl = "https://api.search.brave.com";
        private int defaultCount = 5;
    }
}
