package com.mendwatch.core.remediation;

import com.mendwatch.core.detect.Detector;
import com.mendwatch.core.engine.ErrorIntake;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.model.TaskType;
import com.mendwatch.core.security.PathGuard;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the detector for LINTING (one file) and PROJECT_SCAN (every project file) tasks.
 */
public class DetectionHandler implements TaskHandler {

    private final PathGuard pathGuard;
    private final Detector detector;
    private final ErrorIntake intake;

    public DetectionHandler(PathGuard pathGuard, Detector detector, ErrorIntake intake) {
        this.pathGuard = pathGuard;
        this.detector = detector;
        this.intake = intake;
    }

    @Override
    public Result<String> handle(Task task) {
        List<Path> files;
        if (task.type() == TaskType.PROJECT_SCAN) {
            try {
                files = pathGuard.walkProjectFiles();
            } catch (IOException e) {
                return Result.failure(ErrorKind.TRANSIENT, "Cannot list project files: " + e.getMessage());
            }
        } else {
            Path file = pathGuard.resolve(task.file());
            if (!pathGuard.isAllowed(file)) {
                return Result.failure(ErrorKind.VALIDATION, "Path not allowed: " + task.file());
            }
            files = List.of(file);
        }
        List<DetectedError> detected = detector.scan(files);
        List<DetectedError> recorded = intake.ingest(detected);
        return Result.ok(String.format("Scanned %d file(s): %d finding(s), %d new",
                files.size(), detected.size(), recorded.size()));
    }
}
