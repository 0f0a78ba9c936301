package com.eyelevel.flambientprocessor.exception;

import java.io.Serial;

/**
 * Thrown for fatal remote editing outcomes: a {@code failed} status, or nothing uploaded to edit.
 */
public class RemoteEditException extends FlambientProcessingException {
    @Serial
    private static final long serialVersionUID = 2219871604430914735L;

    public RemoteEditException(String message) {
        super(message);
    }

    public RemoteEditException(String message, Throwable cause) {
        super(message, cause);
    }
}
