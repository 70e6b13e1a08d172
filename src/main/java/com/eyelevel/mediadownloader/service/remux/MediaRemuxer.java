package com.eyelevel.mediadownloader.service.remux;

import java.nio.file.Path;

/**
 * Repackages a downloaded stream into a playable container without re-encoding.
 */
public interface MediaRemuxer {

    /**
     * @param input       The downloaded stream.
     * @param output      Where to write the repackaged file; replaced if present.
     * @param contextInfo Log prefix identifying the job.
     * @throws com.eyelevel.mediadownloader.exception.RemuxException if the tool fails.
     * @throws com.eyelevel.mediadownloader.exception.DownloadCancelledException if interrupted.
     */
    void remux(Path input, Path output, String contextInfo);
}
