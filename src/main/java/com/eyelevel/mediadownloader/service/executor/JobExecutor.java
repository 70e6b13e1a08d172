package com.eyelevel.mediadownloader.service.executor;

import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.model.JobOutcome;
import com.eyelevel.mediadownloader.service.scheduler.DownloadRunContext;

/**
 * Performs one job end-to-end.
 */
public interface JobExecutor {

    /**
     * Per-job failures are reported through the returned outcome, never thrown.
     *
     * @throws com.eyelevel.mediadownloader.exception.StorageExhaustedException if the output
     *         location can no longer take files, which ends the whole run.
     */
    JobOutcome execute(DownloadJob job, DownloadRunContext context);
}
