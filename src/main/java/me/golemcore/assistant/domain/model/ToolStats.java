package me.golemcore.assistant.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ToolStats {

    @JsonProperty("total_tools")
    int totalTools;

    @JsonProperty("tools_by_category")
    Map<String, Integer> toolsByCategory;

    @JsonProperty("tools_by_danger_level")
    Map<String, Integer> toolsByDangerLevel;

    @JsonProperty("enabled_tools")
    int enabledTools;
}
