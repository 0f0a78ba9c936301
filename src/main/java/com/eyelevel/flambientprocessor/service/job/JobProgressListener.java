package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;

/**
 * Observer of a running job. Every callback is a no-op by default.
 */
public interface JobProgressListener {

    JobProgressListener NONE = new JobProgressListener() {
    };

    default void stepStarted(ImagenJob job, ImagenJobStatus step) {
    }

    default void stepCompleted(ImagenJob job, ImagenJobStatus step) {
    }

    default void uploadProgress(ImagenJob job, String filename, int uploaded, int total) {
    }

    default void downloadProgress(ImagenJob job, String filename, int downloaded, int total) {
    }

    /**
     * Remote edit or export progress, reported only when it increases.
     */
    default void remoteProgress(ImagenJob job, ImagenJobStatus step, int percent) {
    }

    default void jobFailed(ImagenJob job, Throwable error) {
    }

    default void jobCompleted(ImagenJob job) {
    }
}
