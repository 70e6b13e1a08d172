package com.eyelevel.mediadownloader.service.job;

import com.eyelevel.mediadownloader.model.DownloadJob;

/**
 * Receives jobs from a {@link JobProducer}.
 */
public interface JobSink {

    /**
     * Hands a job over for execution, waiting while the sink is at capacity.
     *
     * @throws InterruptedException if interrupted while waiting for capacity.
     * @throws IllegalStateException if the sink no longer accepts jobs.
     * @throws com.eyelevel.mediadownloader.exception.DownloadCancelledException if the run was
     *         cancelled while waiting.
     */
    void submit(DownloadJob job) throws InterruptedException;
}
