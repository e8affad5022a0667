package me.golemcore.assistant.domain.exception;

public class ToolConfirmationRequiredException extends AssistantException {

    private static final long serialVersionUID = 1L;

    public ToolConfirmationRequiredException(String message) {
        super(message);
    }
}
