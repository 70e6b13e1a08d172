package com.eyelevel.mediadownloader.model;

/**
 * What a retry does after the raw download succeeded but remuxing it failed.
 */
public enum RemuxRetryMode {
    /**
     * Keep the raw download and repeat only the remux step.
     */
    REMUX_ONLY,
    /**
     * Discard the raw download and fetch it again.
     */
    REFETCH
}
