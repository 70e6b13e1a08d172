package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * The origin did not answer in time (HTTP 504), or the local response timeout elapsed.
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3470532647126757975L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }

    public GatewayTimeoutException(String message, Throwable cause) {
        super(message, 504, cause);
    }
}
