package com.eyelevel.flambientprocessor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a remote editing job.
 *
 * <p>Running states move forward one step at a time. {@link #FAILED} is reachable from any
 * non-terminal state, and every running state may be re-entered from {@link #FAILED} on resume.
 * {@link #COMPLETED} and {@link #CANCELLED} are terminal.
 */
@Getter
@RequiredArgsConstructor
public enum ImagenJobStatus {
    /**
     * Created with a frozen manifest; no remote call made yet.
     */
    PENDING("Pending"),
    UPLOADING("Uploading"),
    PROCESSING("Processing"),
    EXPORTING("Exporting"),
    DOWNLOADING("Downloading"),
    COMPLETED("Completed"),
    /**
     * Stopped by an error; resumable from the step that failed.
     */
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String label;

    public boolean isResumable() {
        return !isTerminal();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean isRunning() {
        return this == UPLOADING || this == PROCESSING || this == EXPORTING || this == DOWNLOADING;
    }

    /**
     * @return the following pipeline state, or {@code null} outside the forward chain.
     */
    public ImagenJobStatus next() {
        return switch (this) {
            case PENDING -> UPLOADING;
            case UPLOADING -> PROCESSING;
            case PROCESSING -> EXPORTING;
            case EXPORTING -> DOWNLOADING;
            case DOWNLOADING -> COMPLETED;
            default -> null;
        };
    }

    public boolean canTransitionTo(ImagenJobStatus target) {
        if (isTerminal() || target == null) {
            return false;
        }
        if (target == FAILED || target == CANCELLED) {
            return true;
        }
        if (this == FAILED) {
            return target.isRunning();
        }
        return target == this || target == next();
    }
}
