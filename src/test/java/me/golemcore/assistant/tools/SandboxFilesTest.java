package me.golemcore.assistant.tools;

import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.security.InjectionGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SandboxFilesTest {

    @TempDir
    Path tempDir;

    private Path sandboxDir;
    private SandboxFiles sandbox;

    @BeforeEach
    void setUp() {
        sandboxDir = tempDir.resolve("sandbox");
        AssistantProperties properties = new AssistantProperties();
        properties.getTools().setSandboxPath(sandboxDir.toString());
        sandbox = new SandboxFiles(properties, new InjectionGuard());
    }

    @Test
    void shouldCreateSandboxDirectory() {
        assertTrue(Files.isDirectory(sandboxDir));
        assertEquals(sandboxDir.toAbsolutePath().normalize(), sandbox.getSandboxRoot());
    }

    @Test
    void shouldResolveRelativePaths() {
        Path resolved = sandbox.resolve("notes/today.txt").orElseThrow();

        assertEquals(sandbox.getSandboxRoot().resolve("notes/today.txt"), resolved);
        assertEquals("notes/today.txt".replace('/', java.io.File.separatorChar), sandbox.relativePath(resolved));
    }

    @Test
    void shouldTreatBlankPathAsRoot() {
        Path root = sandbox.resolve("  ").orElseThrow();

        assertTrue(sandbox.isRoot(root));
        assertEquals(".", sandbox.relativePath(root));
        assertTrue(sandbox.isRoot(sandbox.resolve(null).orElseThrow()));
    }

    @Test
    void shouldBlockEscapes() {
        assertTrue(sandbox.resolve("../outside.txt").isEmpty());
        assertTrue(sandbox.resolve("a/../../outside.txt").isEmpty());
        assertTrue(sandbox.resolve("..").isEmpty());
        assertTrue(sandbox.resolve(tempDir.resolve("other.txt").toString()).isEmpty());
        assertTrue(sandbox.resolve("%2e%2e%2fsecret").isEmpty());
    }

    @Test
    void shouldAllowDotsInsideNames() {
        assertTrue(sandbox.resolve("archive..old.txt").isPresent());
        assertTrue(sandbox.resolve("./a/./b.txt").isPresent());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldBlockSymlinkEscape() throws Exception {
        Path outside = Files.writeString(tempDir.resolve("secret.txt"), "secret");
        Files.createSymbolicLink(sandboxDir.resolve("link.txt"), outside);

        assertTrue(sandbox.resolve("link.txt").isEmpty());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldBlockNewFileUnderSymlinkedDirectory() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.createSymbolicLink(sandboxDir.resolve("link"), outside);

        assertTrue(sandbox.resolve("link/escaped.txt").isEmpty());
        assertTrue(sandbox.resolve("link/nested/escaped.txt").isEmpty());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldBlockDanglingSymlink() throws Exception {
        Files.createDirectories(tempDir.resolve("outside"));
        Files.createSymbolicLink(sandboxDir.resolve("dangling.txt"), tempDir.resolve("outside/missing.txt"));
        Files.createSymbolicLink(sandboxDir.resolve("gone"), tempDir.resolve("outside/missing-dir"));

        assertTrue(sandbox.resolve("dangling.txt").isEmpty());
        assertTrue(sandbox.resolve("gone/file.txt").isEmpty());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldAllowSymlinkInsideSandbox() throws Exception {
        Path target = Files.createDirectories(sandboxDir.resolve("real"));
        Files.createSymbolicLink(sandboxDir.resolve("alias"), target);

        assertTrue(sandbox.resolve("alias/new.txt").isPresent());
    }

    @Test
    void shouldFormatSizes() {
        assertEquals("512 B", SandboxFiles.formatSize(512));
        assertEquals("1.5 KB", SandboxFiles.formatSize(1536));
        assertEquals("2.0 MB", SandboxFiles.formatSize(2L * 1024 * 1024));
    }
}
