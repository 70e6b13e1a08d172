package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * The origin is unavailable (HTTP 503), or could not be connected to at all.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1146077295382899385L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, 503, cause);
    }
}
