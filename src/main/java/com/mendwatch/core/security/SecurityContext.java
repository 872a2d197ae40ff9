package com.mendwatch.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Set;

/**
 * Immutable security context established once at startup.
 *
 * @param projectRoot       canonical project root every file operation is confined to
 * @param allowedOperations capabilities granted to the engine ("read", "write", "analyze")
 * @param token             opaque token identifying this context
 */
public record SecurityContext(
    Path projectRoot,
    Set<String> allowedOperations,
    String token
) {

    private static final Logger log = LoggerFactory.getLogger(SecurityContext.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    public SecurityContext {
        allowedOperations = Set.copyOf(allowedOperations);
    }

    /**
     * Validates the project root and creates a context with a fresh token.
     * A missing root directory is created.
     *
     * @throws SecurityViolationException if the root is not a readable directory
     */
    public static SecurityContext create(Path root, Collection<String> allowedOperations) {
        if (root == null) {
            throw new SecurityViolationException("Project root must be set");
        }
        Path absolute = root.toAbsolutePath().normalize();
        try {
            if (!Files.exists(absolute)) {
                Files.createDirectories(absolute);
                log.info("Created project root {}", absolute);
            } else if (!Files.isDirectory(absolute)) {
                throw new SecurityViolationException("Project root is not a directory: " + absolute);
            }
            if (!Files.isReadable(absolute)) {
                throw new SecurityViolationException("Project root is not readable: " + absolute);
            }
            Path canonical = absolute.toRealPath();
            return new SecurityContext(canonical, Set.copyOf(allowedOperations), generateToken());
        } catch (IOException e) {
            throw new SecurityViolationException("Invalid project root: " + absolute, e);
        }
    }

    public boolean permits(String capability) {
        return allowedOperations.contains(capability);
    }

    /** Constant-time comparison against this context's token. */
    public boolean verifyToken(String candidate) {
        if (candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(
                candidate.getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "SecurityContext[projectRoot=" + projectRoot + ", allowedOperations=" + allowedOperations + "]";
    }

    private static String generateToken() {
        byte[] seed = new byte[32];
        RANDOM.nextBytes(seed);
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(seed));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
