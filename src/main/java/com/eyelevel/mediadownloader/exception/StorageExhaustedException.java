package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * Thrown when the output location can no longer accept files (disk full, read-only or
 * unwritable directory). This aborts the entire run rather than a single job.
 */
public class StorageExhaustedException extends DownloadException {
    @Serial
    private static final long serialVersionUID = -172237242060633201L;

    public StorageExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
