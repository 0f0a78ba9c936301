package com.eyelevel.flambientprocessor.cli;

import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.service.job.JobProgressListener;
import lombok.RequiredArgsConstructor;

/**
 * Prints job progress to the operator console.
 */
@RequiredArgsConstructor
public class ConsoleProgressListener implements JobProgressListener {

    private final OperatorConsole console;

    @Override
    public void stepStarted(ImagenJob job, ImagenJobStatus step) {
        String description = switch (step) {
            case UPLOADING -> "Step 1/4: Uploading images...";
            case PROCESSING -> "Step 2/4: Editing with profile " + job.getProfileKey() + "...";
            case EXPORTING -> "Step 3/4: Exporting to JPEG...";
            case DOWNLOADING -> "Step 4/4: Downloading edited images...";
            default -> step.getLabel();
        };
        console.info(description);
    }

    @Override
    public void uploadProgress(ImagenJob job, String filename, int uploaded, int total) {
        console.note("[" + uploaded + "/" + total + "] " + filename);
    }

    @Override
    public void downloadProgress(ImagenJob job, String filename, int downloaded, int total) {
        console.note("[" + downloaded + "/" + total + "] " + filename);
    }

    @Override
    public void remoteProgress(ImagenJob job, ImagenJobStatus step, int percent) {
        console.note(step.getLabel() + ": " + percent + "%");
    }

    @Override
    public void jobFailed(ImagenJob job, Throwable error) {
        console.error("Job failed: " + job.getErrorMessage());
    }
}
