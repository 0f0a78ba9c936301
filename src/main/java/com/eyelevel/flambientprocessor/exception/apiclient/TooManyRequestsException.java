package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote API is rate limiting this client (HTTP 429); retried with backoff.
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6576126133407459351L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
