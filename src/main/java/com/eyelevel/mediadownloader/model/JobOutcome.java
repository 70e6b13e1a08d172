package com.eyelevel.mediadownloader.model;

import java.nio.file.Path;

/**
 * The result of executing one {@link DownloadJob}. Every submitted job yields exactly one outcome.
 *
 * @param job        The job this outcome belongs to.
 * @param status     Final disposition.
 * @param outputPath Where the file was written, or {@code null} unless completed.
 * @param attempts   Number of fetch attempts made; zero for skipped jobs.
 * @param reason     Failure or cancellation reason, {@code null} otherwise.
 */
public record JobOutcome(DownloadJob job, OutcomeStatus status, Path outputPath, int attempts, String reason) {

    public static JobOutcome completed(DownloadJob job, Path outputPath, int attempts) {
        return new JobOutcome(job, OutcomeStatus.COMPLETED, outputPath, attempts, null);
    }

    public static JobOutcome skipped(DownloadJob job) {
        return new JobOutcome(job, OutcomeStatus.SKIPPED, null, 0, "Output already exists");
    }

    public static JobOutcome failed(DownloadJob job, int attempts, String reason) {
        return new JobOutcome(job, OutcomeStatus.FAILED, null, attempts, reason);
    }

    public static JobOutcome cancelled(DownloadJob job, int attempts) {
        return new JobOutcome(job, OutcomeStatus.CANCELLED, null, attempts, "Run cancelled");
    }
}
