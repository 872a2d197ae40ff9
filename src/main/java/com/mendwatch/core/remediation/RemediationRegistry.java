package com.mendwatch.core.remediation;

import com.mendwatch.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps each {@link ErrorKind} to the {@link Remediation} run when a task fails with it, and
 * counts failures per kind.
 */
public class RemediationRegistry {

    private static final Logger log = LoggerFactory.getLogger(RemediationRegistry.class);

    private final Map<ErrorKind, Remediation> remediations = new ConcurrentHashMap<>();
    private final Map<ErrorKind, AtomicInteger> failures = new ConcurrentHashMap<>();

    public RemediationRegistry register(ErrorKind kind, Remediation remediation) {
        remediations.put(kind, remediation);
        return this;
    }

    /**
     * Runs the remediation registered for the failure's kind. Exceptions thrown by the
     * remediation are logged and not propagated.
     */
    public void handle(Task task, Result<?> failure) {
        if (failure.isOk()) {
            return;
        }
        failures.computeIfAbsent(failure.kind(), k -> new AtomicInteger()).incrementAndGet();
        Remediation remediation = remediations.get(failure.kind());
        if (remediation == null) {
            log.warn("No remediation for {} failure of task {}: {}", failure.kind(), task.id(), failure.message());
            return;
        }
        try {
            remediation.apply(task, failure);
        } catch (RuntimeException e) {
            log.error("Remediation for task {} ({}) failed: {}", task.id(), failure.kind(), e.getMessage(), e);
        }
    }

    /** Failure counts per kind since startup. */
    public Map<ErrorKind, Integer> stats() {
        var result = new EnumMap<ErrorKind, Integer>(ErrorKind.class);
        failures.forEach((kind, count) -> result.put(kind, count.get()));
        return Collections.unmodifiableMap(result);
    }
}
