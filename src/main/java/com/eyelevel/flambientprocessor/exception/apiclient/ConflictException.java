package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote project is in a state that conflicts with the request (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6680149003417742351L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
