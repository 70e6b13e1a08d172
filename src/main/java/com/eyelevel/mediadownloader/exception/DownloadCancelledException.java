package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * Signals that work stopped because the run was cancelled. Never reported as a job failure.
 */
public class DownloadCancelledException extends DownloadException {
    @Serial
    private static final long serialVersionUID = -3026239342489546536L;

    public DownloadCancelledException(String message) {
        super(message);
    }

    public DownloadCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
