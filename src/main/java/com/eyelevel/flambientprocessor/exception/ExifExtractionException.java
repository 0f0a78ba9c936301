package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Thrown when the EXIF extraction tool fails or its output cannot be parsed. Fatal for the run.
 */
public class ExifExtractionException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public ExifExtractionException(String message) {
        super(message);
    }

    public ExifExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
