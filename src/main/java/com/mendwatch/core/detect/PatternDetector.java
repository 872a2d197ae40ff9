package com.mendwatch.core.detect;

import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorSeverity;
import com.mendwatch.core.security.FileOperation;
import com.mendwatch.core.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented detector that flags error markers left in files (interpreter traces, build
 * output captured into the tree) and trailing whitespace.
 * <p>
 * Every read goes through {@link PathGuard#validate(FileOperation, Path)}; files that fail the
 * check or cannot be decoded are skipped. At most one error per (line, type) is reported.
 */
public class PatternDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    public static final String STYLE = "Style";

    private static final List<Marker> MARKERS = List.of(
            new Marker("SyntaxError", Pattern.compile("SyntaxError: (.+)$"), ErrorSeverity.HIGH),
            new Marker("IndentationError", Pattern.compile("IndentationError: (.+)$"), ErrorSeverity.HIGH),
            new Marker("ImportError", Pattern.compile("(?:ImportError|ModuleNotFoundError): (.+)$"), ErrorSeverity.HIGH),
            new Marker("TypeError", Pattern.compile("TypeError: (.+)$"), ErrorSeverity.MEDIUM),
            new Marker("NameError", Pattern.compile("NameError: (.+)$"), ErrorSeverity.MEDIUM),
            new Marker("AttributeError", Pattern.compile("AttributeError: (.+)$"), ErrorSeverity.MEDIUM),
            new Marker("BuildError", Pattern.compile("\\[ERROR\\]\\s*(.+)$"), ErrorSeverity.MEDIUM)
    );

    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t]+$");

    private final PathGuard pathGuard;

    public PatternDetector(PathGuard pathGuard) {
        this.pathGuard = pathGuard;
    }

    @Override
    public List<DetectedError> scan(List<Path> paths) {
        var found = new ArrayList<DetectedError>();
        for (Path path : paths) {
            Path file = pathGuard.projectRoot().resolve(path).normalize();
            if (!pathGuard.validate(FileOperation.READ, file)) {
                continue;
            }
            try {
                found.addAll(scanFile(file));
            } catch (IOException | UncheckedIOException e) {
                log.debug("Skipping {}: {}", file, e.getMessage());
            }
        }
        return found;
    }

    List<DetectedError> scanFile(Path file) throws IOException {
        String relative = pathGuard.projectRoot().relativize(file).toString();
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        var errors = new ArrayList<DetectedError>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            for (Marker marker : MARKERS) {
                Matcher m = marker.pattern().matcher(line);
                if (m.find()) {
                    errors.add(DetectedError.of(marker.errorType(), m.group(1).trim(), relative,
                            lineNumber, marker.severity()));
                    break;
                }
            }
            if (TRAILING_WHITESPACE.matcher(line).find()) {
                errors.add(DetectedError.of(STYLE, "Trailing whitespace", relative, lineNumber,
                        ErrorSeverity.LOW));
            }
        }
        if (!errors.isEmpty()) {
            log.debug("Found {} error(s) in {}", errors.size(), relative);
        }
        return errors;
    }

    private record Marker(String errorType, Pattern pattern, ErrorSeverity severity) {}
}
