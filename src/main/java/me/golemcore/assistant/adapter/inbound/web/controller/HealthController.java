package me.golemcore.assistant.adapter.inbound.web.controller;

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
import me.golemcore.assistant.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.port.outbound.LlmPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint. The inference probe is a live call, so it runs off the
 * event loop.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final LlmPort llmPort;
    private final AssistantProperties properties;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.fromCallable(llmPort::isAvailable)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.debug("[API] LLM health probe failed: {}", e.getMessage());
                    return Mono.just(false);
                })
                .map(llmAvailable -> {
                    Map<String, Boolean> services = new LinkedHashMap<>();
                    services.put("llm", llmAvailable);
                    services.put("file_system", Files.isDirectory(Paths.get(properties.getTools().getSandboxPath())));
                    services.put("logging", true);
                    HealthResponse response = HealthResponse.builder()
                            .status("healthy")
                            .version(properties.getVersion())
                            .services(services)
                            .healthy(services.values().stream().allMatch(Boolean::booleanValue))
                            .build();
                    return ResponseEntity.ok(response);
                });
    }
}
