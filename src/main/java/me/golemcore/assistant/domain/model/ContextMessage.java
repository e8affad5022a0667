package me.golemcore.assistant.domain.model;

/**
 * Read-only {role, content} projection of a message, used to bound the prompt
 * sent to the inference backend.
 */
public record ContextMessage(String role, String content) {

    public ContextMessage withContent(String newContent) {
        return new ContextMessage(role, newContent);
    }
}
