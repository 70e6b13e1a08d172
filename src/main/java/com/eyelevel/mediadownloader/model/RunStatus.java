package com.eyelevel.mediadownloader.model;

/**
 * How a run ended as a whole.
 */
public enum RunStatus {
    /**
     * Every submitted job produced an outcome. Individual jobs may still have failed.
     */
    COMPLETED,
    /**
     * The run was stopped early on request.
     */
    CANCELLED,
    /**
     * A fatal error stopped the run.
     */
    ABORTED
}
