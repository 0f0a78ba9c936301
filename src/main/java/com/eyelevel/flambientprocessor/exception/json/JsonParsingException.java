package com.eyelevel.flambientprocessor.exception.json;

import com.eyelevel.flambientprocessor.exception.FlambientProcessingException;

import java.io.Serial;

/**
 * A JSON payload, either a remote API response or a stored job column, could not be read or written.
 */
public class JsonParsingException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message) {
        super(message);
    }

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
