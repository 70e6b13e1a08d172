package com.eyelevel.mediadownloader.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregate result of a download run, handed to the host process once the scheduler is done.
 * <p>
 * Per-job failures are counted in {@link #failed}; they never abort the run. A run stopped by a
 * fatal error carries it in {@link #fatalError}. Cancellation is an outcome in its own right and
 * keeps whatever finished before it.
 */
@Value
@Builder
public class RunResult {

    int completed;
    int skipped;
    int failed;
    /**
     * Jobs that were queued or in flight when the run stopped early.
     */
    int abandoned;
    boolean cancelled;
    Throwable fatalError;
    @Singular
    List<JobOutcome> outcomes;

    public RunStatus getStatus() {
        if (fatalError != null) {
            return RunStatus.ABORTED;
        }
        return cancelled ? RunStatus.CANCELLED : RunStatus.COMPLETED;
    }

    /**
     * Number of jobs that reached a completed, skipped or failed disposition.
     */
    public int finished() {
        return completed + skipped + failed;
    }

    public boolean isSuccessful() {
        return failed == 0 && getStatus() == RunStatus.COMPLETED;
    }

    /**
     * Process exit status for the host: 0 only if no job failed and the run neither aborted nor
     * was cancelled.
     */
    public int exitCode() {
        return isSuccessful() ? 0 : 1;
    }

    public String summary() {
        return String.format("%s: %d completed, %d skipped, %d failed, %d abandoned", getStatus(), completed,
                skipped, failed, abandoned);
    }
}
