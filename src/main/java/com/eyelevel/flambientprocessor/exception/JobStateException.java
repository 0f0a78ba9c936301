package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Thrown on an illegal job status transition, or an attempt to mutate a completed or cancelled job.
 */
public class JobStateException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = -6043981250017612391L;

    public JobStateException(String message) {
        super(message);
    }
}
