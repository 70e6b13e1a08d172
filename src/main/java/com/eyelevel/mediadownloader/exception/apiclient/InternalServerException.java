package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * The origin failed while serving the request (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3120064639642359190L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
