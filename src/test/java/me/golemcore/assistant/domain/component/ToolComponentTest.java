package me.golemcore.assistant.domain.component;

import me.golemcore.assistant.domain.model.ToolCategory;
import me.golemcore.assistant.domain.model.ToolParameter;
import me.golemcore.assistant.testsupport.StubTool;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ToolComponentTest {

    private final ToolComponent tool = StubTool.named("web_search", ToolCategory.WEB,
            ToolParameter.string("query", "Search query"),
            ToolParameter.builder().name("count").type(ToolParameter.TYPE_INTEGER).required(false).build(),
            ToolParameter.builder().name("safe").type(ToolParameter.TYPE_BOOLEAN).required(false).build());

    @Test
    void shouldAcceptValidParameters() {
        assertEquals(Optional.empty(), tool.validate(Map.of("query", "java")));
        assertEquals(Optional.empty(), tool.validate(Map.of("query", "java", "count", 3, "safe", true)));
        assertEquals(Optional.empty(), tool.validate(Map.of("query", "java", "count", "12", "safe", "FALSE")));
    }

    @Test
    void shouldReportMissingOrBlankRequiredParameter() {
        assertEquals(Optional.of("Missing required parameter: query"), tool.validate(Map.of()));
        assertEquals(Optional.of("Missing required parameter: query"), tool.validate(Map.of("query", "  ")));
        assertEquals(Optional.of("Missing required parameter: query"), tool.validate(null));
    }

    @Test
    void shouldAllowMissingOptionalParameter() {
        Map<String, Object> params = new HashMap<>();
        params.put("query", "java");
        params.put("count", null);

        assertEquals(Optional.empty(), tool.validate(params));
    }

    @Test
    void shouldReportWrongTypes() {
        assertEquals(Optional.of("Parameter 'count' must be of type integer"),
                tool.validate(Map.of("query", "java", "count", "many")));
        assertEquals(Optional.of("Parameter 'safe' must be of type boolean"),
                tool.validate(Map.of("query", "java", "safe", "yes")));
    }

    @Test
    void shouldExposeNameAndEnabledByDefault() {
        assertEquals("web_search", tool.getToolName());
        assertTrue(tool.isEnabled());
    }
}
