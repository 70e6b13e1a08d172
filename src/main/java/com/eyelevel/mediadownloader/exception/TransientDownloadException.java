package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * Thrown when an attempt failed for a reason that may go away on its own (network hiccup,
 * overloaded origin, broken stream). The job is retried while its retry budget lasts.
 */
public class TransientDownloadException extends DownloadException {
    @Serial
    private static final long serialVersionUID = 3102228744887297882L;

    public TransientDownloadException(String message) {
        super(message);
    }

    public TransientDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
