package com.eyelevel.mediadownloader.model;

/**
 * Classification of an attempt's result, used to pick the next attempt state.
 */
public enum FailureClass {
    /**
     * The attempt did not fail.
     */
    NONE,
    TRANSIENT,
    PERMANENT,
    /**
     * Failure that must abort the whole run.
     */
    FATAL,
    CANCELLED
}
