package me.golemcore.assistant.domain.exception;

public class ToolDisabledException extends AssistantException {

    private static final long serialVersionUID = 1L;

    public ToolDisabledException(String message) {
        super(message);
    }
}
