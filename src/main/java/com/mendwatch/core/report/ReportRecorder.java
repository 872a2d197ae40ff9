package com.mendwatch.core.report;

import com.mendwatch.core.detect.ContextExtractor;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorReport;
import com.mendwatch.core.model.ErrorStatus;
import com.mendwatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Writes a report whenever a fix task leaves its error FIXED or FAILED.
 */
public class ReportRecorder {

    private static final Logger log = LoggerFactory.getLogger(ReportRecorder.class);

    private final ErrorStore errorStore;
    private final ContextExtractor contextExtractor;
    private final ReportWriter writer;

    public ReportRecorder(ErrorStore errorStore, ContextExtractor contextExtractor, ReportWriter writer) {
        this.errorStore = errorStore;
        this.contextExtractor = contextExtractor;
        this.writer = writer;
    }

    public List<EventBus.Subscription> subscribe(EventBus eventBus) {
        return List.of(
                eventBus.subscribe("task.completed", this::onTaskFinished),
                eventBus.subscribe("task.failed", this::onTaskFinished));
    }

    void onTaskFinished(MendwatchEvent event) {
        if (!TaskType.FIX_ERROR.name().equals(event.payload().get("type"))) {
            return;
        }
        Object errorId = event.payload().get("errorId");
        if (errorId == null) {
            return;
        }
        Optional<DetectedError> error = errorStore.get(errorId.toString());
        if (error.isEmpty()) {
            return;
        }
        ErrorStatus status = error.get().status();
        if (status == ErrorStatus.FIXED || status == ErrorStatus.FAILED) {
            record(error.get());
        }
    }

    /**
     * Writes a report for {@code error}. Write failures are logged.
     */
    public Optional<ReportFiles> record(DetectedError error) {
        var metrics = new LinkedHashMap<String, Object>();
        metrics.put("fixAttempts", error.fixAttempts());
        metrics.put("maxRetries", error.maxRetries());
        var report = new ErrorReport(error, error.fix(),
                contextExtractor.extract(error.filePath(), error.lineNumber()),
                Instant.now(), "error_fix", error.status(), metrics, recommendationsFor(error));
        try {
            return Optional.of(writer.write(report));
        } catch (IOException e) {
            log.error("Failed to write report for error {}: {}", error.id(), e.getMessage());
            return Optional.empty();
        }
    }

    static List<String> recommendationsFor(DetectedError error) {
        var recommendations = new ArrayList<String>();
        if (error.status() == ErrorStatus.FAILED) {
            recommendations.add(String.format("Review %s:%d manually; automatic remediation stopped after %d attempt(s)",
                    error.filePath(), error.lineNumber(), error.fixAttempts()));
        }
        if (error.fix() != null && error.fix().backupPath() != null) {
            recommendations.add("Original content kept at " + error.fix().backupPath());
        }
        return recommendations;
    }
}
