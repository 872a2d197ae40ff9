package com.mendwatch.core.remediation;

import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks the task's error FAILED without retrying. A later {@link ErrorStore#retry(String)}
 * puts it back in play.
 */
public class GiveUpRemediation implements Remediation {

    private static final Logger log = LoggerFactory.getLogger(GiveUpRemediation.class);

    private final ErrorStore errorStore;

    public GiveUpRemediation(ErrorStore errorStore) {
        this.errorStore = errorStore;
    }

    @Override
    public void apply(Task task, Result<?> failure) {
        log.warn("Task {} failed ({}): {}", task.id(), failure.kind(), failure.message());
        if (task.errorId() != null) {
            errorStore.markFailed(task.errorId());
        }
    }
}
