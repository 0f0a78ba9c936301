package com.eyelevel.flambientprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The request timed out (HTTP 504, also used for client-side timeouts); retried with backoff.
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -117664291870031785L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
