package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur while fetching and publishing a download job.
 */
public class DownloadException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3720958657989204912L;

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
