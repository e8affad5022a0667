package me.golemcore.assistant.tools;

import me.golemcore.assistant.domain.model.DangerLevel;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.security.InjectionGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * read_file, write_file, delete_file and list_directory against a temporary
 * sandbox.
 */
class FileToolsTest {

    private static final String SESSION = "s";
    private static final String PATH = "path";
    private static final String CONTENT = "content";
    private static final String TEST_TXT = "test.txt";
    private static final String INVALID_PATH = "Invalid path: must be within sandbox";

    @TempDir
    Path tempDir;

    private Path sandboxDir;
    private AssistantProperties properties;
    private ReadFileTool readTool;
    private WriteFileTool writeTool;
    private DeleteFileTool deleteTool;
    private ListDirectoryTool listTool;

    @BeforeEach
    void setUp() {
        sandboxDir = tempDir.resolve("sandbox");
        properties = new AssistantProperties();
        properties.getTools().setSandboxPath(sandboxDir.toString());
        SandboxFiles sandbox = new SandboxFiles(properties, new InjectionGuard());
        readTool = new ReadFileTool(sandbox);
        writeTool = new WriteFileTool(sandbox);
        deleteTool = new DeleteFileTool(sandbox);
        listTool = new ListDirectoryTool(sandbox);
    }

    // ==================== read_file ====================

    @Test
    void writeAndReadFile() throws Exception {
        ToolResult write = writeTool.execute(SESSION, Map.of(PATH, TEST_TXT, CONTENT, "Hello, World!")).get();
        assertTrue(write.isSuccess());
        assertEquals("Successfully written to file: test.txt", write.getOutput());

        ToolResult read = readTool.execute(SESSION, Map.of(PATH, TEST_TXT)).get();
        assertTrue(read.isSuccess());
        assertEquals("Hello, World!", read.getOutput());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) read.getData();
        assertEquals(13L, data.get("size"));
        assertEquals(1L, data.get("lines"));
    }

    @Test
    void readMissingFile() throws Exception {
        ToolResult result = readTool.execute(SESSION, Map.of(PATH, "missing.txt")).get();

        assertFalse(result.isSuccess());
        assertEquals("File not found: missing.txt", result.getError());
    }

    @Test
    void readRejectsDisallowedExtension() throws Exception {
        Files.write(sandboxDir.resolve("tool.exe"), new byte[] { 1, 2 });

        ToolResult result = readTool.execute(SESSION, Map.of(PATH, "tool.exe")).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("File type not allowed"));
    }

    @Test
    void readRejectsDirectory() throws Exception {
        Files.createDirectories(sandboxDir.resolve("docs.txt"));

        ToolResult result = readTool.execute(SESSION, Map.of(PATH, "docs.txt")).get();

        assertEquals("Not a file: docs.txt", result.getError());
    }

    @Test
    void readRejectsOversizedFile() throws Exception {
        properties.getTools().setMaxFileSizeMb(1);
        Files.write(sandboxDir.resolve("big.txt"), new byte[1024 * 1024 + 1]);

        ToolResult result = readTool.execute(SESSION, Map.of(PATH, "big.txt")).get();

        assertEquals("File too large (max 1 MB)", result.getError());
    }

    @Test
    void readRejectsTraversal() throws Exception {
        Files.writeString(tempDir.resolve("secret.txt"), "secret");

        ToolResult result = readTool.execute(SESSION, Map.of(PATH, "../secret.txt")).get();

        assertFalse(result.isSuccess());
        assertEquals(INVALID_PATH, result.getError());
    }

    // ==================== write_file ====================

    @Test
    void writeCreatesParentDirectories() throws Exception {
        ToolResult result = writeTool.execute(SESSION, Map.of(PATH, "a/b/c.md", CONTENT, "# Title")).get();

        assertTrue(result.isSuccess());
        assertEquals("# Title", Files.readString(sandboxDir.resolve("a/b/c.md"), StandardCharsets.UTF_8));
    }

    @Test
    void writeOverwritesExistingFile() throws Exception {
        Files.writeString(sandboxDir.resolve(TEST_TXT), "old content that is longer");

        writeTool.execute(SESSION, Map.of(PATH, TEST_TXT, CONTENT, "new")).get();

        assertEquals("new", Files.readString(sandboxDir.resolve(TEST_TXT)));
    }

    @Test
    void writeWithoutContentCreatesEmptyFile() throws Exception {
        Map<String, Object> params = new HashMap<>();
        params.put(PATH, "empty.txt");

        ToolResult result = writeTool.execute(SESSION, params).get();

        assertTrue(result.isSuccess());
        assertEquals(0L, Files.size(sandboxDir.resolve("empty.txt")));
    }

    @Test
    void writeRejectsEscapeAndRoot() throws Exception {
        assertEquals(INVALID_PATH,
                writeTool.execute(SESSION, Map.of(PATH, "../evil.txt", CONTENT, "x")).get().getError());
        assertEquals(INVALID_PATH, writeTool.execute(SESSION, Map.of(PATH, ".", CONTENT, "x")).get().getError());
        assertFalse(Files.exists(tempDir.resolve("evil.txt")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void writeRejectsNewFileThroughSymlinkedDirectory() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.createSymbolicLink(sandboxDir.resolve("link"), outside);

        ToolResult result = writeTool.execute(SESSION, Map.of(PATH, "link/escaped.txt", CONTENT, "x")).get();

        assertEquals(INVALID_PATH, result.getError());
        assertFalse(Files.exists(outside.resolve("escaped.txt")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void writeRejectsDanglingSymlink() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.createSymbolicLink(sandboxDir.resolve("dangling.txt"), outside.resolve("missing.txt"));

        ToolResult result = writeTool.execute(SESSION, Map.of(PATH, "dangling.txt", CONTENT, "x")).get();

        assertEquals(INVALID_PATH, result.getError());
        assertFalse(Files.exists(outside.resolve("missing.txt")));
    }

    @Test
    void writeRejectsDisallowedExtension() throws Exception {
        ToolResult result = writeTool.execute(SESSION, Map.of(PATH, "run.sh", CONTENT, "rm -rf /")).get();

        assertFalse(result.isSuccess());
        assertFalse(Files.exists(sandboxDir.resolve("run.sh")));
    }

    @Test
    void writeDeclaresConfirmation() {
        assertTrue(writeTool.getMetadata().isRequiresConfirmation());
        assertEquals(DangerLevel.MEDIUM, writeTool.getMetadata().getDangerLevel());
    }

    // ==================== delete_file ====================

    @Test
    void deleteFile() throws Exception {
        Files.writeString(sandboxDir.resolve(TEST_TXT), "bye");

        ToolResult result = deleteTool.execute(SESSION, Map.of(PATH, TEST_TXT)).get();

        assertTrue(result.isSuccess());
        assertEquals("Deleted: test.txt", result.getOutput());
        assertFalse(Files.exists(sandboxDir.resolve(TEST_TXT)));
    }

    @Test
    void deleteEmptyDirectory() throws Exception {
        Files.createDirectories(sandboxDir.resolve("empty"));

        assertTrue(deleteTool.execute(SESSION, Map.of(PATH, "empty")).get().isSuccess());
        assertFalse(Files.exists(sandboxDir.resolve("empty")));
    }

    @Test
    void deleteRefusesNonEmptyDirectory() throws Exception {
        Files.createDirectories(sandboxDir.resolve("full"));
        Files.writeString(sandboxDir.resolve("full/keep.txt"), "keep");

        ToolResult result = deleteTool.execute(SESSION, Map.of(PATH, "full")).get();

        assertEquals("Directory not empty: full", result.getError());
        assertTrue(Files.exists(sandboxDir.resolve("full/keep.txt")));
    }

    @Test
    void deleteMissingPath() throws Exception {
        assertEquals("Path not found: ghost.txt",
                deleteTool.execute(SESSION, Map.of(PATH, "ghost.txt")).get().getError());
    }

    @Test
    void deleteRefusesSandboxRoot() throws Exception {
        assertEquals(INVALID_PATH, deleteTool.execute(SESSION, Map.of(PATH, ".")).get().getError());
        assertTrue(Files.isDirectory(sandboxDir));
    }

    // ==================== list_directory ====================

    @Test
    void listDirectorySorted() throws Exception {
        Files.writeString(sandboxDir.resolve("b.txt"), "12345");
        Files.createDirectories(sandboxDir.resolve("a_dir"));

        ToolResult result = listTool.execute(SESSION, Map.of()).get();

        assertTrue(result.isSuccess());
        assertEquals("Directory: .\nEntries: 2\n\n[DIR]  a_dir/\n[FILE] b.txt (5 B)\n", result.getOutput());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> entries = (List<Map<String, Object>>) ((Map<String, Object>) result.getData())
                .get("entries");
        assertEquals("directory", entries.get(0).get("type"));
        assertEquals(5L, entries.get(1).get("size"));
    }

    @Test
    void listSubdirectory() throws Exception {
        Files.createDirectories(sandboxDir.resolve("docs"));
        Files.writeString(sandboxDir.resolve("docs/readme.md"), "hi");

        ToolResult result = listTool.execute(SESSION, Map.of(PATH, "docs")).get();

        assertTrue(result.getOutput().startsWith("Directory: docs\nEntries: 1"));
    }

    @Test
    void listRejectsFileAndMissingPath() throws Exception {
        Files.writeString(sandboxDir.resolve(TEST_TXT), "x");

        assertEquals("Not a directory: test.txt", listTool.execute(SESSION, Map.of(PATH, TEST_TXT)).get().getError());
        assertEquals("Directory not found: nope", listTool.execute(SESSION, Map.of(PATH, "nope")).get().getError());
        assertEquals(INVALID_PATH, listTool.execute(SESSION, Map.of(PATH, "../")).get().getError());
    }

    @Test
    void listPathIsOptional() {
        assertTrue(listTool.validate(Map.of()).isEmpty());
    }
}
