package me.golemcore.assistant.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChatStats {

    @JsonProperty("active_sessions")
    int activeSessions;

    @JsonProperty("total_conversations")
    int totalConversations;

    @JsonProperty("total_messages")
    long totalMessages;
}
