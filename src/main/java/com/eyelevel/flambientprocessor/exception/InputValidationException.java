package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Thrown for operator input errors (missing directory, no matching images). No job is created.
 */
public class InputValidationException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = 1730922981541207744L;

    public InputValidationException(String message) {
        super(message);
    }
}
