package me.golemcore.assistant.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Incremental text fragment of a streamed answer. The final chunk carries
 * {@code done = true} and may have empty text.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private boolean done;
    private LlmUsage usage;
}
