package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote API rejected the request payload (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3521097125480233417L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
