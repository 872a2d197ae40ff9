package com.mendwatch.core.agent;

import com.mendwatch.core.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Applies the {@link PathGuard} content denylist to every project file. Each file with a
 * dangerous construct counts as one vulnerability and costs ten points of score. A project root
 * that cannot be walked fails the scan rather than scoring an empty project.
 */
public class ContentSecurityScanner implements SecurityScanner {

    private static final Logger log = LoggerFactory.getLogger(ContentSecurityScanner.class);

    static final int PENALTY_PER_FINDING = 10;

    /** Larger files are skipped. */
    static final long MAX_FILE_BYTES = 1024 * 1024;

    private final PathGuard pathGuard;

    public ContentSecurityScanner(PathGuard pathGuard) {
        this.pathGuard = pathGuard;
    }

    @Override
    public SecurityScan scan() {
        List<Path> files;
        try {
            files = pathGuard.walkProjectFiles();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot walk project root " + pathGuard.projectRoot(), e);
        }
        int vulnerabilities = 0;
        for (Path file : files) {
            try {
                if (Files.size(file) > MAX_FILE_BYTES) {
                    continue;
                }
                String content = Files.readString(file, StandardCharsets.UTF_8);
                var finding = pathGuard.screenContent(content);
                if (finding.isPresent()) {
                    vulnerabilities++;
                    log.debug("Security finding in {}: {}", file, finding.get());
                }
            } catch (MalformedInputException e) {
                log.trace("Skipping binary file {}", file);
            } catch (IOException e) {
                log.debug("Could not scan {}: {}", file, e.getMessage());
            }
        }
        int score = Math.max(0, 100 - PENALTY_PER_FINDING * vulnerabilities);
        return new SecurityScan(score, vulnerabilities);
    }
}
