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
import me.golemcore.assistant.adapter.inbound.web.dto.UploadResponse;
import me.golemcore.assistant.domain.exception.PayloadTooLargeException;
import me.golemcore.assistant.domain.service.ChatOrchestrator;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;

/**
 * Multipart upload into the tool sandbox. The part is buffered only up to the
 * configured size limit; past it the remaining bytes are counted and released.
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class UploadController {

    private final ChatOrchestrator chatOrchestrator;
    private final AssistantProperties properties;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<UploadResponse>> upload(@RequestParam("session_id") String sessionId,
            @RequestPart("file") FilePart file) {
        String filename = file.filename();
        if (filename == null || filename.isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "No filename provided"));
        }
        AssistantProperties.ToolsProperties tools = properties.getTools();
        return file.content()
                .collect(() -> new BoundedContent(tools.getMaxFileSizeBytes()), BoundedContent::append)
                .flatMap(content -> {
                    if (content.isOverflowed()) {
                        return Mono.error(PayloadTooLargeException.forFileSize(content.getSize(),
                                tools.getMaxFileSizeMb()));
                    }
                    return chatOrchestrator.uploadFile(sessionId, filename, content.toByteArray());
                })
                .map(result -> ResponseEntity.ok(UploadResponse.builder()
                        .success(true)
                        .file(result.getData())
                        .build()));
    }

    static final class BoundedContent {

        private final long maxBytes;
        private ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private long size;

        BoundedContent(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        void append(DataBuffer buffer) {
            try {
                int count = buffer.readableByteCount();
                size += count;
                if (size > maxBytes) {
                    bytes = null;
                    return;
                }
                byte[] chunk = new byte[count];
                buffer.read(chunk);
                bytes.write(chunk, 0, count);
            } finally {
                DataBufferUtils.release(buffer);
            }
        }

        boolean isOverflowed() {
            return bytes == null;
        }

        long getSize() {
            return size;
        }

        byte[] toByteArray() {
            return bytes.toByteArray();
        }
    }
}
