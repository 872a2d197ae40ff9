package com.mendwatch.core.remediation;

import com.mendwatch.core.detect.PatternDetector;
import com.mendwatch.core.model.Change;
import com.mendwatch.core.model.DetectedError;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strips trailing spaces and tabs from the line an error points at. Line endings are kept.
 */
public class TrailingWhitespaceFixStrategy implements FixStrategy {

    private static final Pattern TRAILING = Pattern.compile("[ \\t]+$");
    private static final Pattern LINE = Pattern.compile("(?<=\\n)|(?<=\\r(?!\\n))");

    @Override
    public String errorType() {
        return PatternDetector.STYLE;
    }

    @Override
    public String fixType() {
        return "trailing_whitespace";
    }

    @Override
    public Optional<FixProposal> propose(DetectedError error, String content) {
        String[] lines = LINE.split(content, -1);
        int index = error.lineNumber() - 1;
        if (index < 0 || index >= lines.length) {
            return Optional.empty();
        }
        String line = lines[index];
        String ending = line.endsWith("\r\n") ? "\r\n" : line.endsWith("\n") ? "\n" : line.endsWith("\r") ? "\r" : "";
        String body = line.substring(0, line.length() - ending.length());
        String stripped = TRAILING.matcher(body).replaceAll("");
        if (stripped.equals(body)) {
            return Optional.of(new FixProposal(content, List.of(), "Line " + error.lineNumber() + " already clean"));
        }
        lines[index] = stripped + ending;
        return Optional.of(new FixProposal(
                String.join("", lines),
                List.of(new Change("replace", body, stripped)),
                "Removed trailing whitespace on line " + error.lineNumber()));
    }
}
