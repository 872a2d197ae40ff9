package com.mendwatch.core.remediation;

import com.mendwatch.core.model.Task;

/**
 * Follow-up action for a task that failed with a given {@link ErrorKind}.
 */
@FunctionalInterface
public interface Remediation {

    void apply(Task task, Result<?> failure);
}
