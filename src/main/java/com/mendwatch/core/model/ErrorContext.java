package com.mendwatch.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Source context captured around an error for reporting.
 *
 * @param fileContent  full file text at detection time
 * @param lineContent  the offending line
 * @param lineNumber   1-based line number
 * @param functionName enclosing function or method (nullable)
 * @param className    enclosing class (nullable)
 * @param imports      import lines of the file
 */
public record ErrorContext(
    String fileContent,
    String lineContent,
    int lineNumber,
    String functionName,
    String className,
    List<String> imports
) implements Serializable {

    public ErrorContext {
        imports = imports == null ? List.of() : List.copyOf(imports);
    }

    public static ErrorContext empty() {
        return new ErrorContext("", "", 0, null, null, List.of());
    }
}
