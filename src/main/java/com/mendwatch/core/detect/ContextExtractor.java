package com.mendwatch.core.detect;

import com.mendwatch.core.model.ErrorContext;
import com.mendwatch.core.security.FileOperation;
import com.mendwatch.core.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Captures the source context of an error for reports: the offending line, the import lines,
 * and the nearest enclosing function and class found by scanning upwards.
 */
public class ContextExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContextExtractor.class);

    private static final Pattern IMPORT = Pattern.compile("^\\s*(import\\s|from\\s+\\S+\\s+import\\s)");
    private static final Pattern FUNCTION = Pattern.compile(
            "^\\s*(?:async\\s+)?def\\s+(\\w+)|^\\s*(?:public|protected|private|static)\\b[\\w<>\\[\\],\\s]*\\s(\\w+)\\s*\\(");
    private static final Pattern CLASS = Pattern.compile("^\\s*(?:public\\s+|final\\s+|abstract\\s+)*(?:class|interface|record|enum)\\s+(\\w+)");

    private final PathGuard pathGuard;

    public ContextExtractor(PathGuard pathGuard) {
        this.pathGuard = pathGuard;
    }

    /**
     * @param filePath   path relative to the project root
     * @param lineNumber 1-based line, 0 when unknown
     * @return the context, or {@link ErrorContext#empty()} if the file cannot be read
     */
    public ErrorContext extract(String filePath, int lineNumber) {
        if (filePath == null) {
            return ErrorContext.empty();
        }
        Path file = pathGuard.resolve(filePath);
        if (!pathGuard.validate(FileOperation.READ, file)) {
            return ErrorContext.empty();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            List<String> lines = content.lines().toList();
            var imports = new ArrayList<String>();
            for (String line : lines) {
                if (IMPORT.matcher(line).find()) {
                    imports.add(line.trim());
                }
            }
            String lineContent = lineNumber >= 1 && lineNumber <= lines.size() ? lines.get(lineNumber - 1) : "";
            String function = null;
            String className = null;
            for (int i = Math.min(lineNumber, lines.size()) - 1; i >= 0; i--) {
                String line = lines.get(i);
                if (className == null) {
                    Matcher c = CLASS.matcher(line);
                    if (c.find()) {
                        className = c.group(1);
                        continue;
                    }
                }
                if (function == null && className == null) {
                    Matcher f = FUNCTION.matcher(line);
                    if (f.find()) {
                        function = f.group(1) != null ? f.group(1) : f.group(2);
                    }
                }
            }
            return new ErrorContext(content, lineContent, lineNumber, function, className, imports);
        } catch (IOException e) {
            log.warn("Could not read context for {}: {}", filePath, e.getMessage());
            return ErrorContext.empty();
        }
    }
}
