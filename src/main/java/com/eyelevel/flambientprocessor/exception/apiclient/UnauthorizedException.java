package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The API key was missing or rejected (HTTP 401). Never retried.
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7219530823312170521L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
