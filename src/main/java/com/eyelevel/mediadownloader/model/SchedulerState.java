package com.eyelevel.mediadownloader.model;

/**
 * Lifecycle of a download scheduler. Transitions only move forward.
 */
public enum SchedulerState {
    /**
     * Accepting submissions.
     */
    OPEN,
    /**
     * Closed for submissions; queued and in-flight jobs are finishing.
     */
    DRAINING,
    /**
     * Terminal.
     */
    DONE
}
