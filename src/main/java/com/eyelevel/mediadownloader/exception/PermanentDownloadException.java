package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * Thrown when retrying a job cannot change its result. The job fails on the spot and its
 * remaining retry budget is not consumed.
 */
public class PermanentDownloadException extends DownloadException {
    @Serial
    private static final long serialVersionUID = -651203574895259915L;

    public PermanentDownloadException(String message) {
        super(message);
    }

    public PermanentDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
