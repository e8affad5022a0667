package me.golemcore.assistant;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Assistant backend.
 *
 * <p>
 * A local chat assistant service: it keeps in-memory chat sessions, relays
 * conversations to an inference backend (Ollama by default), parses
 * {@code [TOOL: name(args)]} requests out of the model's answers and runs them
 * against sandboxed tools, asking the user for confirmation before dangerous
 * operations.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → REST controllers (blocking and SSE)
 * Domain Layer       → ChatOrchestrator, SessionCoordinator, ToolRegistry, ToolExecutor
 * Infrastructure     → LLM adapters (Ollama, langchain4j), sandboxed tools
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code assistant.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssistantApplication.class, args);
    }

}
