package me.golemcore.assistant.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.Session;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionInfoResponse {
    private Session session;

    @JsonProperty("message_count")
    private int messageCount;

    @JsonProperty("last_messages")
    private List<Message> lastMessages;
}
