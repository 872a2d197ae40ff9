package com.mendwatch.core.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecurityContextTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("creates a missing project root")
    void createsMissingRoot() {
        Path root = tempDir.resolve("new-project");

        var ctx = SecurityContext.create(root, List.of("read"));

        assertTrue(Files.isDirectory(root));
        assertEquals(ctx.projectRoot(), ctx.projectRoot().normalize());
    }

    @Test
    @DisplayName("rejects a root that is a regular file")
    void rejectsFileRoot() throws Exception {
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        assertThrows(SecurityViolationException.class,
                () -> SecurityContext.create(file, List.of("read")));
    }

    @Test
    @DisplayName("token is 64 hex characters and verifies only itself")
    void tokenVerification() {
        var ctx = SecurityContext.create(tempDir, List.of("read", "write"));

        assertTrue(ctx.token().matches("[0-9a-f]{64}"));
        assertTrue(ctx.verifyToken(ctx.token()));
        assertFalse(ctx.verifyToken(ctx.token().substring(1)));
        assertFalse(ctx.verifyToken(null));
    }

    @Test
    @DisplayName("each context gets a different token")
    void tokensDiffer() {
        var a = SecurityContext.create(tempDir, List.of("read"));
        var b = SecurityContext.create(tempDir, List.of("read"));

        assertNotEquals(a.token(), b.token());
    }

    @Test
    @DisplayName("toString does not leak the token")
    void toStringMasksToken() {
        var ctx = SecurityContext.create(tempDir, List.of("read"));

        assertFalse(ctx.toString().contains(ctx.token()));
    }

    @Test
    @DisplayName("permits only granted capabilities")
    void permits() {
        var ctx = SecurityContext.create(tempDir, List.of("read", "analyze"));

        assertTrue(ctx.permits("read"));
        assertTrue(ctx.permits("analyze"));
        assertFalse(ctx.permits("write"));
    }
}
