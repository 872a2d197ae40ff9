package com.mendwatch.core.detect;

import com.mendwatch.core.model.DetectedError;

import java.nio.file.Path;
import java.util.List;

/**
 * Finds errors in a set of project files. Implementations must not throw for unreadable files;
 * they skip them.
 */
@FunctionalInterface
public interface Detector {

    List<DetectedError> scan(List<Path> paths);
}
