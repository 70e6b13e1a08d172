package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * The origin is throttling this client (HTTP 429). Treated as a signal to back off, not as a refusal.
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 4545545051961931231L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
