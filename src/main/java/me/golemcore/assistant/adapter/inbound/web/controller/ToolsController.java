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
import me.golemcore.assistant.domain.exception.ToolNotFoundException;
import me.golemcore.assistant.domain.model.ToolCall;
import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.domain.service.ChatOrchestrator;
import me.golemcore.assistant.domain.service.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/chat/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ChatOrchestrator chatOrchestrator;
    private final ToolRegistry toolRegistry;

    /**
     * Runs a tool call for a session. A refused or failed tool still answers 200
     * with {@code success=false}; only lookup and validation errors change the
     * status.
     */
    @PostMapping("/execute")
    public Mono<ResponseEntity<ToolResult>> execute(@RequestParam("session_id") String sessionId,
            @RequestParam(defaultValue = "false") boolean confirm,
            @RequestBody ToolCall toolCall) {
        return chatOrchestrator.executeTool(sessionId, toolCall, confirm)
                .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> listTools() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tools", toolRegistry.list());
        body.put("stats", toolRegistry.getStats());
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/{toolName}")
    public Mono<ResponseEntity<Map<String, Object>>> getTool(@PathVariable String toolName) {
        ToolMetadata metadata = toolRegistry.getMetadata(toolName)
                .orElseThrow(() -> ToolNotFoundException.forName(toolName));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("metadata", metadata);
        body.put("usage_help", toolRegistry.getUsageHelp(metadata));
        return Mono.just(ResponseEntity.ok(body));
    }
}
