package com.mendwatch.core.errors;

import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorStatus;
import com.mendwatch.core.model.Fix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of detected errors keyed by id.
 * <p>
 * Holds at most one unresolved error per (file, line, type). Every reader and mutator takes the
 * same lock, so callers always see a consistent snapshot. Errors are immutable records, so the
 * values returned are safe to keep.
 */
public class ErrorStore {

    private static final Logger log = LoggerFactory.getLogger(ErrorStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DetectedError> errors = new LinkedHashMap<>();
    private final Clock clock;

    public ErrorStore() {
        this(Clock.systemUTC());
    }

    public ErrorStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records a new error.
     *
     * @return false if the id is already known or an unresolved error with the same
     *         (file, line, type) exists
     */
    public boolean add(DetectedError error) {
        if (error == null) {
            return false;
        }
        lock.lock();
        try {
            if (errors.containsKey(error.id())) {
                log.debug("Error {} already recorded", error.id());
                return false;
            }
            var key = error.key();
            for (DetectedError existing : errors.values()) {
                if (!existing.isResolved() && existing.key().equals(key)) {
                    log.debug("Duplicate of unresolved error {} at {}:{} ({})",
                            existing.id(), key.filePath(), key.lineNumber(), key.errorType());
                    return false;
                }
            }
            errors.put(error.id(), error);
            log.info("New error {} at {}:{} ({}): {}", error.id(), error.filePath(),
                    error.lineNumber(), error.errorType(), error.message());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<DetectedError> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(errors.get(id));
        } finally {
            lock.unlock();
        }
    }

    public List<DetectedError> list() {
        lock.lock();
        try {
            return List.copyOf(errors.values());
        } finally {
            lock.unlock();
        }
    }

    public List<DetectedError> listUnresolved() {
        lock.lock();
        try {
            return errors.values().stream().filter(e -> !e.isResolved()).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attaches {@code fix} and marks the error FIXED. Calling it on an already fixed error
     * leaves the first fix in place and returns true.
     *
     * @return false if the error is unknown
     */
    public boolean markResolved(String id, Fix fix) {
        lock.lock();
        try {
            DetectedError error = errors.get(id);
            if (error == null) {
                log.warn("Cannot resolve unknown error {}", id);
                return false;
            }
            if (error.isResolved()) {
                return true;
            }
            errors.put(id, error.resolvedWith(fix, clock.instant()));
            log.info("Error {} resolved by {}", id, fix != null ? fix.fixType() : "external fix");
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** PENDING -> IN_PROGRESS. */
    public boolean markInProgress(String id) {
        return transition(id, ErrorStatus.PENDING, ErrorStatus.IN_PROGRESS);
    }

    /**
     * Gives up on an error. Fixed errors are left alone.
     */
    public boolean markFailed(String id) {
        lock.lock();
        try {
            DetectedError error = errors.get(id);
            if (error == null || error.isResolved()) {
                return false;
            }
            if (error.status() != ErrorStatus.FAILED) {
                errors.put(id, error.withStatus(ErrorStatus.FAILED, clock.instant()));
                log.warn("Error {} marked failed after {} attempt(s)", id, error.fixAttempts());
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** FAILED -> PENDING, the only backwards transition. */
    public boolean retry(String id) {
        return transition(id, ErrorStatus.FAILED, ErrorStatus.PENDING);
    }

    /**
     * Increments the fix-attempt counter. Callers compare the result against
     * {@link DetectedError#maxRetries()} to decide whether to keep retrying.
     *
     * @return the new attempt count, or -1 if the error is unknown
     */
    public int incrementFixAttempts(String id) {
        lock.lock();
        try {
            DetectedError error = errors.get(id);
            if (error == null) {
                return -1;
            }
            int attempts = error.fixAttempts() + 1;
            errors.put(id, error.withFixAttempts(attempts, clock.instant()));
            return attempts;
        } finally {
            lock.unlock();
        }
    }

    public ErrorStats stats() {
        lock.lock();
        try {
            var byType = new TreeMap<String, Integer>();
            var byFile = new TreeMap<String, Integer>();
            int resolved = 0;
            for (DetectedError error : errors.values()) {
                if (error.isResolved()) {
                    resolved++;
                }
                byType.merge(error.errorType(), 1, Integer::sum);
                byFile.merge(String.valueOf(error.filePath()), 1, Integer::sum);
            }
            return new ErrorStats(errors.size(), resolved, errors.size() - resolved,
                    Collections.unmodifiableMap(byType), Collections.unmodifiableMap(byFile));
        } finally {
            lock.unlock();
        }
    }

    private boolean transition(String id, ErrorStatus from, ErrorStatus to) {
        lock.lock();
        try {
            DetectedError error = errors.get(id);
            if (error == null || error.status() != from) {
                return false;
            }
            errors.put(id, error.withStatus(to, clock.instant()));
            return true;
        } finally {
            lock.unlock();
        }
    }
}
