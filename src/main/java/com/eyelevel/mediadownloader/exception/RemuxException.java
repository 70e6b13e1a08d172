package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * Thrown when the external muxer could not repackage a downloaded stream into its target container.
 */
public class RemuxException extends TransientDownloadException {
    @Serial
    private static final long serialVersionUID = -2875293200062377941L;

    public RemuxException(String message) {
        super(message);
    }

    public RemuxException(String message, Throwable cause) {
        super(message, cause);
    }
}
