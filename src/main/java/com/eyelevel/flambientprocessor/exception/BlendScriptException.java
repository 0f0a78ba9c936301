package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Thrown when blend scripts cannot be written to disk or the compositing engine cannot be started.
 */
public class BlendScriptException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = -2291877712860346014L;

    public BlendScriptException(String message) {
        super(message);
    }

    public BlendScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
