package com.mendwatch.core.remediation;

import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.Fix;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.security.FileOperation;
import com.mendwatch.core.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a {@link FixStrategy} to the error a FIX_ERROR task points at.
 * <p>
 * The file is read and written only after {@link PathGuard} approves the operation, and the
 * proposed content must pass {@link PathGuard#verifyFix}. A copy of the original is kept under
 * {@code .mendwatch/backups} before it is overwritten.
 */
public class FixErrorHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(FixErrorHandler.class);

    static final String BACKUP_DIR = ".mendwatch/backups";
    private static final DateTimeFormatter BACKUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final PathGuard pathGuard;
    private final ErrorStore errorStore;
    private final Map<String, FixStrategy> strategies = new HashMap<>();
    private final Clock clock;

    public FixErrorHandler(PathGuard pathGuard, ErrorStore errorStore, List<FixStrategy> strategies) {
        this(pathGuard, errorStore, strategies, Clock.systemUTC());
    }

    public FixErrorHandler(PathGuard pathGuard, ErrorStore errorStore, List<FixStrategy> strategies, Clock clock) {
        this.pathGuard = pathGuard;
        this.errorStore = errorStore;
        this.clock = clock;
        for (FixStrategy strategy : strategies) {
            this.strategies.put(strategy.errorType(), strategy);
        }
    }

    @Override
    public Result<String> handle(Task task) {
        if (task.errorId() == null) {
            return Result.failure(ErrorKind.VALIDATION, "Task " + task.id() + " has no error to fix");
        }
        Optional<DetectedError> found = errorStore.get(task.errorId());
        if (found.isEmpty()) {
            return Result.failure(ErrorKind.VALIDATION, "Unknown error " + task.errorId());
        }
        DetectedError error = found.get();
        if (error.isResolved()) {
            return Result.ok("Error " + error.id() + " already fixed");
        }
        FixStrategy strategy = strategies.get(error.errorType());
        if (strategy == null) {
            return Result.failure(ErrorKind.UNRECOVERABLE, "No fix strategy for " + error.errorType());
        }
        errorStore.markInProgress(error.id());

        Path file = pathGuard.resolve(error.filePath());
        if (!pathGuard.validate(FileOperation.READ, file)) {
            return Result.failure(ErrorKind.EXECUTION, "Cannot read " + error.filePath());
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return Result.failure(ErrorKind.TRANSIENT, "Failed to read " + error.filePath() + ": " + e.getMessage());
        }

        Optional<FixProposal> proposal = strategy.propose(error, content);
        if (proposal.isEmpty()) {
            return Result.failure(ErrorKind.EXECUTION, strategy.fixType() + " could not fix " + error.id());
        }
        FixProposal fix = proposal.get();
        if (fix.isNoop()) {
            errorStore.markResolved(error.id(), new Fix(error.id(), true, fix.message(), strategy.fixType(),
                    List.of(), null, clock.instant()));
            return Result.ok(fix.message());
        }
        if (!pathGuard.verifyFix(error, fix.content())) {
            return Result.failure(ErrorKind.VALIDATION, "Proposed fix for " + error.id() + " was rejected");
        }

        Instant now = clock.instant();
        String backup;
        try {
            backup = backup(file, now);
            Files.writeString(file, fix.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return Result.failure(ErrorKind.EXECUTION, "Failed to write " + error.filePath() + ": " + e.getMessage());
        }
        errorStore.markResolved(error.id(), new Fix(error.id(), true, fix.message(), strategy.fixType(),
                fix.changes(), backup, now));
        log.info("Applied {} to {}:{}", strategy.fixType(), error.filePath(), error.lineNumber());
        return Result.ok(fix.message());
    }

    private String backup(Path file, Instant at) throws IOException {
        Path root = pathGuard.projectRoot();
        Path relative = root.relativize(file.toAbsolutePath().normalize());
        Path target = root.resolve(BACKUP_DIR)
                .resolve(relative + "." + BACKUP_STAMP.format(at) + ".bak");
        Files.createDirectories(target.getParent());
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        return root.relativize(target).toString();
    }
}
