package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * An upstream gateway in front of the remote API failed (HTTP 502); retried with backoff.
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8314460215528719316L;

    public BadGatewayException(String message) {
        super(message, 502);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
