package com.eyelevel.flambientprocessor.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors raised while talking to the remote editing API or its signed transfer URLs.
 *
 * <p>Carries the HTTP status code (or a synthetic 5xx code for connection-level failures) and
 * classifies the failure as transient or fatal. Transient failures are retried by the client;
 * fatal ones propagate to the job state machine.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
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

    public ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return {@code true} when repeating the same request later may succeed.
     */
    public boolean isTransient() {
        return false;
    }
}
