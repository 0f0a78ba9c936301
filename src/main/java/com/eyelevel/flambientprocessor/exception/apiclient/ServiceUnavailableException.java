package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote API could not be reached or is temporarily unavailable (HTTP 503, also used for
 * connection failures); retried with backoff.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2812514621225838422L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
