package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * The origin refused access to the media (HTTP 403), typically an expired or hot-link protected URL.
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2710643736215022197L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
