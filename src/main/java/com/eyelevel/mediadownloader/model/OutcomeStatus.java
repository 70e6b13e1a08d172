package com.eyelevel.mediadownloader.model;

/**
 * Final disposition of a single job.
 */
public enum OutcomeStatus {
    COMPLETED,
    SKIPPED,
    FAILED,
    /**
     * The run was cancelled before or while the job executed. Not a failure.
     */
    CANCELLED
}
