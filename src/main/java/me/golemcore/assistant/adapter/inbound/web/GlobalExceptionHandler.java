package me.golemcore.assistant.adapter.inbound.web;

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
import me.golemcore.assistant.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.assistant.domain.exception.ConversationNotFoundException;
import me.golemcore.assistant.domain.exception.InferenceUnavailableException;
import me.golemcore.assistant.domain.exception.PayloadTooLargeException;
import me.golemcore.assistant.domain.exception.SessionNotFoundException;
import me.golemcore.assistant.domain.exception.ToolConfirmationRequiredException;
import me.golemcore.assistant.domain.exception.ToolDisabledException;
import me.golemcore.assistant.domain.exception.ToolExecutionException;
import me.golemcore.assistant.domain.exception.ToolNotFoundException;
import me.golemcore.assistant.domain.exception.ToolValidationException;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps the assistant's exception hierarchy onto HTTP statuses for the REST
 * controllers. Unclassified errors become a generic 500 whose message is only
 * exposed when {@code assistant.debug} is set.
 */
@ControllerAdvice(basePackages = "me.golemcore.assistant.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    private static final String INTERNAL_ERROR = "Internal server error";

    private final AssistantProperties properties;

    public GlobalExceptionHandler(AssistantProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler({ SessionNotFoundException.class, ToolNotFoundException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(RuntimeException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ToolValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleValidation(ToolValidationException ex) {
        log.warn("[API] Validation failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ToolConfirmationRequiredException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConfirmationRequired(ToolConfirmationRequiredException ex) {
        log.info("[API] Confirmation required: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ToolDisabledException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleDisabled(ToolDisabledException ex) {
        log.warn("[API] Tool disabled: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler(ToolExecutionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleToolExecution(ToolExecutionException ex) {
        log.error("[API] Tool execution failed: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(ConversationNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConversationNotFound(ConversationNotFoundException ex) {
        log.error("[API] Session without conversation: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(InferenceUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInferenceUnavailable(InferenceUnavailableException ex) {
        log.error("[API] Inference unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handlePayloadTooLarge(PayloadTooLargeException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        String message = properties.isDebug() && ex.getMessage() != null ? ex.getMessage() : INTERNAL_ERROR;
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
