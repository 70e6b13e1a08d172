package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * An upstream proxy or CDN node could not reach the origin (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2814409114471009789L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
