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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Spring configuration that provides shared infrastructure beans and prepares
 * the runtime on startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Exposes the {@link Clock} used for session activity and expiry</li>
 * <li>Exposes the shared Jackson {@link ObjectMapper}</li>
 * <li>Creates the tool sandbox directory and logs the inference settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AssistantProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Assistant v{} starting...", properties.getVersion());
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        log.info("Model: {}", properties.getLlm().getModel());
        log.info("Session timeout: {} min, sweep every {}s",
                properties.getChat().getSessionTimeoutMinutes(),
                properties.getChat().getSweepIntervalSeconds());

        Path sandbox = Paths.get(properties.getTools().getSandboxPath()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(sandbox);
            log.info("Sandbox: {}", sandbox);
        } catch (IOException e) {
            log.error("Failed to create sandbox directory: {}", sandbox, e);
        }
    }
}
