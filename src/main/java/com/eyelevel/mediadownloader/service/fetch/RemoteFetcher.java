package com.eyelevel.mediadownloader.service.fetch;

import com.eyelevel.mediadownloader.model.DownloadJob;

/**
 * Issues the remote request for a job and hands back the response body as a stream.
 */
public interface RemoteFetcher {

    /**
     * Opens the job's source. The caller owns the returned response and must close it.
     *
     * @param job The job whose source to fetch, with its referer and headers.
     * @return the open response.
     * @throws com.eyelevel.mediadownloader.exception.apiclient.ApiException if the origin answers
     *         with an error status or cannot be reached.
     * @throws com.eyelevel.mediadownloader.exception.DownloadCancelledException if the calling
     *         thread is interrupted while waiting for the response.
     */
    FetchResponse fetch(DownloadJob job);
}
