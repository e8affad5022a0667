package me.golemcore.assistant.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.assistant.domain.model.ChatTurnState;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.ToolCall;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    @JsonProperty("session_id")
    private String sessionId;

    private Message message;

    @JsonProperty("tool_calls")
    private List<ToolCall> toolCalls;

    @JsonProperty("requires_confirmation")
    private boolean requiresConfirmation;

    private ChatTurnState state;
}
