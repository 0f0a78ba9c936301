package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote project or resource does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2901655125730119052L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
