package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a remote status never reached a terminal value within the configured attempts.
 */
public class PollingTimeoutException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = -8392019845716021113L;

    public PollingTimeoutException(String message) {
        super(message);
    }
}
