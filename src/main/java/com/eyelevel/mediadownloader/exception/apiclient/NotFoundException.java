package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * The media no longer exists at the requested location (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -533446135244924212L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
