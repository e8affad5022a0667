package me.golemcore.assistant.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DangerLevel {

    SAFE, LOW, MEDIUM, HIGH;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
