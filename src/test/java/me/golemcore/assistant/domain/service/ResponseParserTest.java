package me.golemcore.assistant.domain.service;

import me.golemcore.assistant.domain.model.ToolCall;
import me.golemcore.assistant.domain.model.ToolCategory;
import me.golemcore.assistant.domain.model.ToolParameter;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.testsupport.StubTool;
import me.golemcore.assistant.tools.WebSearchTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    private ToolRegistry registry;
    private ResponseParser parser;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(null);
        registry.register(StubTool.named("web_search", ToolCategory.WEB,
                ToolParameter.string("query", "Search query"),
                ToolParameter.builder().name("count").type(ToolParameter.TYPE_INTEGER).required(false).build()));
        registry.register(StubTool.named("read_file", ToolCategory.FILE_SYSTEM,
                ToolParameter.string("path", "File path")));
        registry.register(StubTool.named("write_file", ToolCategory.FILE_SYSTEM,
                ToolParameter.string("path", "File path"),
                ToolParameter.string("content", "Content")));
        parser = new ResponseParser(registry, new ToolConfirmationPolicy(registry));
    }

    @Test
    void shouldReturnEmptyListForPlainText() {
        assertTrue(parser.parse("Just a normal answer.").isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    void shouldParseSingleQuotedArgument() {
        List<ToolCall> calls = parser.parse("Let me check. [TOOL: web_search(\"java records\")]");

        assertEquals(1, calls.size());
        ToolCall call = calls.get(0);
        assertEquals("web_search", call.getToolName());
        assertEquals(Map.of("query", "java records"), call.getParameters());
        assertFalse(call.isRequiresConfirmation());
    }

    @Test
    void shouldMapPositionalArgumentsInDeclaredOrder() {
        List<ToolCall> calls = parser.parse("[TOOL: write_file(\"notes.txt\", \"hello, world\")]");

        assertEquals(1, calls.size());
        assertEquals("notes.txt", calls.get(0).getParameters().get("path"));
        assertEquals("hello, world", calls.get(0).getParameters().get("content"));
        assertTrue(calls.get(0).isRequiresConfirmation());
    }

    @Test
    void shouldMapNamedArguments() {
        List<ToolCall> calls = parser.parse("[TOOL: web_search(count=3, query=\"weather\")]");

        assertEquals("weather", calls.get(0).getParameters().get("query"));
        assertEquals(3, calls.get(0).getParameters().get("count"));
    }

    @Test
    void shouldConvertIntegerParameters() {
        List<ToolCall> calls = parser.parse("[TOOL: web_search(\"news\", 7)]");

        assertEquals(7, calls.get(0).getParameters().get("count"));
    }

    @Test
    void shouldReturnCallsInTextOrder() {
        String response = "First [TOOL: read_file(\"a.txt\")] then [TOOL: web_search('b')] and [TOOL: read_file(c.txt)]";

        List<ToolCall> calls = parser.parse(response);

        assertEquals(3, calls.size());
        assertEquals("a.txt", calls.get(0).getParameters().get("path"));
        assertEquals("b", calls.get(1).getParameters().get("query"));
        assertEquals("c.txt", calls.get(2).getParameters().get("path"));
        assertEquals("read_file_0", calls.get(0).getId());
        assertEquals("read_file_2", calls.get(2).getId());
    }

    @Test
    void shouldMatchAcrossLineBreaks() {
        List<ToolCall> calls = parser.parse("[TOOL: write_file(\"a.txt\", \"line1\nline2\")]");

        assertEquals("line1\nline2", calls.get(0).getParameters().get("content"));
    }

    @Test
    void shouldKeepUnknownToolWithEmptyParameters() {
        List<ToolCall> calls = parser.parse("[TOOL: teleport(\"mars\")]");

        assertEquals(1, calls.size());
        assertEquals("teleport", calls.get(0).getToolName());
        assertTrue(calls.get(0).getParameters().isEmpty());
        assertFalse(calls.get(0).isRequiresConfirmation());
    }

    @Test
    void shouldUseWellKnownNamesForUnregisteredTools() {
        List<ToolCall> calls = parser.parse("[TOOL: delete_file(\"old.txt\")] [TOOL: system_command(\"ls -la\")]");

        assertEquals(Map.of("path", "old.txt"), calls.get(0).getParameters());
        assertTrue(calls.get(0).isRequiresConfirmation());
        assertEquals(Map.of("command", "ls -la"), calls.get(1).getParameters());
        assertTrue(calls.get(1).isRequiresConfirmation());
    }

    @Test
    void shouldLeaveParametersEmptyWhenTooManyArguments() {
        List<ToolCall> calls = parser.parse("[TOOL: write_file(\"a\", \"b\", \"c\")]");

        assertTrue(calls.get(0).getParameters().isEmpty());
    }

    @Test
    void shouldKeepUnquotedCommaQueryWhole() {
        ToolRegistry webRegistry = new ToolRegistry(null);
        webRegistry.register(new WebSearchTool(null, new AssistantProperties()));
        ResponseParser webParser = new ResponseParser(webRegistry, new ToolConfirmationPolicy(webRegistry));

        List<ToolCall> calls = webParser.parse("[TOOL: web_search(best pizza in Rome, Italy)]");

        assertEquals(Map.of("query", "best pizza in Rome, Italy"), calls.get(0).getParameters());
    }

    @Test
    void shouldStillMapQueryAndCountWhenCountIsNumeric() {
        List<ToolCall> calls = parser.parse("[TOOL: web_search(java, 3)]");

        assertEquals(Map.of("query", "java", "count", 3), calls.get(0).getParameters());
    }

    @Test
    void shouldJoinExtraArgumentsIntoSoleTextParameter() {
        List<ToolCall> calls = parser.parse("[TOOL: web_search(cats, dogs, birds)]");

        assertEquals(Map.of("query", "cats, dogs, birds"), calls.get(0).getParameters());
    }

    @Test
    void shouldHandleEmptyArgumentList() {
        List<ToolCall> calls = parser.parse("[TOOL: read_file()]");

        assertEquals(1, calls.size());
        assertTrue(calls.get(0).getParameters().isEmpty());
    }

    @Test
    void shouldIgnoreMalformedMarkers() {
        assertTrue(parser.parse("[TOOL web_search(\"x\")] [TOOL: web_search \"x\"] TOOL: read_file(a)").isEmpty());
    }

    @Test
    void shouldSplitOnlyOnTopLevelCommas() {
        assertEquals(List.of("\"a,b\"", "'c'", "[1, 2]", "d"),
                ResponseParser.splitArguments("\"a,b\", 'c', [1, 2], d"));
        assertEquals(List.of("\"say \\\"hi, there\\\"\""),
                ResponseParser.splitArguments("\"say \\\"hi, there\\\"\""));
    }

    @Test
    void shouldStripOneLayerOfQuotes() {
        assertEquals("abc", ResponseParser.stripQuotes("\"abc\""));
        assertEquals("abc", ResponseParser.stripQuotes("'abc'"));
        assertEquals("'abc'", ResponseParser.stripQuotes("\"'abc'\""));
        assertEquals("abc", ResponseParser.stripQuotes("abc"));
        assertEquals("", ResponseParser.stripQuotes("\""));
    }
}
