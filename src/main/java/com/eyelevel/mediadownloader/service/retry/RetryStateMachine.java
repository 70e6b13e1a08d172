package com.eyelevel.mediadownloader.service.retry;

import com.eyelevel.mediadownloader.model.AttemptState;
import com.eyelevel.mediadownloader.model.FailureClass;

/**
 * Pure transition function of a job's attempt cycle. Holds no per-job state, so one instance may
 * serve every job that shares the same budget and backoff parameters.
 */
public class RetryStateMachine {

    private final int maxAttempts;
    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;

    public RetryStateMachine(int maxAttempts, long initialDelayMs, double multiplier, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Decides what follows attempt number {@code attempt} (1-based) ending with {@code failure}.
     *
     * @param failure How the attempt ended; {@link FailureClass#NONE} for success.
     * @param attempt The number of the attempt that just ended.
     * @return {@link AttemptState#BACKING_OFF} when another attempt should follow, otherwise a
     *         terminal state.
     */
    public AttemptState next(FailureClass failure, int attempt) {
        return switch (failure) {
            case NONE -> AttemptState.SUCCEEDED;
            case TRANSIENT -> attempt < maxAttempts ? AttemptState.BACKING_OFF : AttemptState.FAILED_TRANSIENT;
            case PERMANENT, FATAL, CANCELLED -> AttemptState.FAILED_PERMANENT;
        };
    }

    /**
     * Delay before the attempt following attempt number {@code attempt}: grows geometrically and
     * is capped at the configured maximum.
     */
    public long backoffFor(int attempt) {
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxDelayMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
