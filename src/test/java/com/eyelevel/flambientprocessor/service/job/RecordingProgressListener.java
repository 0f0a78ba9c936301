package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;

import java.util.ArrayList;
import java.util.List;

public class RecordingProgressListener implements JobProgressListener {

    public final List<String> events = new ArrayList<>();
    public Throwable failure;

    @Override
    public void stepStarted(ImagenJob job, ImagenJobStatus step) {
        events.add("start " + step);
    }

    @Override
    public void stepCompleted(ImagenJob job, ImagenJobStatus step) {
        events.add("done " + step);
    }

    @Override
    public void uploadProgress(ImagenJob job, String filename, int completed, int total) {
        events.add("upload " + filename + " " + completed + "/" + total);
    }

    @Override
    public void downloadProgress(ImagenJob job, String filename, int completed, int total) {
        events.add("download " + filename + " " + completed + "/" + total);
    }

    @Override
    public void jobFailed(ImagenJob job, Throwable error) {
        events.add("failed");
        failure = error;
    }

    @Override
    public void jobCompleted(ImagenJob job) {
        events.add("completed");
    }
}
