package com.eyelevel.mediadownloader.exception;

import java.io.Serial;

/**
 * Thrown when the remote origin answers with something that is not downloadable media, such as
 * an HTML challenge page or a playlist.
 */
public class UnsupportedContentException extends PermanentDownloadException {
    @Serial
    private static final long serialVersionUID = -3521289658049934810L;

    public UnsupportedContentException(String message) {
        super(message);
    }
}
