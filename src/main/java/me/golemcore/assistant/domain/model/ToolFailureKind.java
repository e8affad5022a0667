package me.golemcore.assistant.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a tool invocation did not succeed.
 */
public enum ToolFailureKind {

    NOT_FOUND, VALIDATION_FAILED, CONFIRMATION_REQUIRED, DISABLED, EXECUTION_FAILED;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
