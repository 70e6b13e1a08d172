package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * Thrown when a response body ended early or broke off mid-stream.
 */
public class IncompleteTransferException extends TransientDownloadException {
    @Serial
    private static final long serialVersionUID = 2671521945691753783L;

    public IncompleteTransferException(String message) {
        super(message);
    }

    public IncompleteTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
