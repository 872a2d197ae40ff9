package com.mendwatch.core.remediation;

import com.mendwatch.core.model.Task;

/**
 * Executes one kind of task. Runs on the event loop.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * @return a summary on success, or a classified failure
     */
    Result<String> handle(Task task);
}
