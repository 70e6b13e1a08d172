package com.eyelevel.mediadownloader.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for failures reported by, or while talking to, a remote media origin.
 *
 * <p>Carries the HTTP status code the origin answered with, or the closest equivalent for
 * failures that never produced a response (connection refused, timeouts). The status code is
 * what decides whether a download attempt is worth repeating.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -2155044242747779381L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Constructs a new ApiException wrapping the low-level failure that caused it.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     * @param cause      The underlying transport failure.
     */
    public ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
