package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The API key is valid but not allowed to perform the operation (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1873002718265934411L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
