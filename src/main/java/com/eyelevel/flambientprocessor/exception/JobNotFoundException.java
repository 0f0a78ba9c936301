package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Thrown when no job matches the given id or id prefix, or the prefix is ambiguous.
 */
public class JobNotFoundException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = 8871126617150372013L;

    public JobNotFoundException(String message) {
        super(message);
    }
}
