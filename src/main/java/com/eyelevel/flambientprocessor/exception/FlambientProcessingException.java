package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Base exception for errors raised by the flambient classification, blending and remote editing pipeline.
 */
public class FlambientProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public FlambientProcessingException(String message) {
        super(message);
    }

    public FlambientProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
