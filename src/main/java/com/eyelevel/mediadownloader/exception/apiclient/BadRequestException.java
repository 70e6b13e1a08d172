package com.eyelevel.mediadownloader.exception.apiclient;

import java.io.Serial;

/**
 * The origin rejected the request as malformed (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3696924657747961324L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
