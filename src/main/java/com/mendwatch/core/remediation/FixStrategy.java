package com.mendwatch.core.remediation;

import com.mendwatch.core.model.DetectedError;

import java.util.Optional;

/**
 * Produces fixed file content for one error type.
 */
public interface FixStrategy {

    /** Error type this strategy handles, e.g. "Style". */
    String errorType();

    /** Name recorded as the fix type. */
    String fixType();

    /**
     * @param error   the error to fix
     * @param content current file content
     * @return the proposal, or empty if this strategy cannot fix the error
     */
    Optional<FixProposal> propose(DetectedError error, String content);
}
