package com.eyelevel.mediadownloader.model;

/**
 * States of a single job's attempt cycle.
 */
public enum AttemptState {
    ATTEMPTING,
    BACKING_OFF,
    SUCCEEDED,
    FAILED_TRANSIENT,
    FAILED_PERMANENT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TRANSIENT || this == FAILED_PERMANENT;
    }
}
