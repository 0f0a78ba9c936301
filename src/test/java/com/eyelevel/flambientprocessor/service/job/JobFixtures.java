package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.model.ImagenJob;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds jobs in a given pipeline position without a database.
 */
public final class JobFixtures {

    private JobFixtures() {
    }

    public static ImagenJob job(Path input, Path output, String... files) {
        ImagenJob job = new ImagenJob();
        job.setId("9b1c4e2a-0000-4000-8000-00000000000a");
        job.setProjectName("Shoot");
        job.setInputDirectory(input.toString());
        job.setOutputDirectory(output.toString());
        job.setProfileKey("309406");
        job.setEditOptions(EditOptions.defaults());
        job.setFileManifest(new ArrayList<>(List.of(files)));
        job.setTotalFiles(files.length);
        return job;
    }

    /**
     * A job that has uploaded its whole manifest into {@code projectId}.
     */
    public static ImagenJob uploaded(Path input, Path output, String projectId, String... files) {
        ImagenJob job = job(input, output, files);
        job.setRemoteProjectId(projectId);
        job.markStarted();
        for (String file : files) {
            job.recordUploadSuccess(file);
        }
        job.markUploadsComplete();
        return job;
    }

    public static ImagenJob downloading(Path input, Path output, String projectId, String... files) {
        ImagenJob job = uploaded(input, output, projectId, files);
        job.markProcessingComplete();
        job.markDownloading();
        return job;
    }
}
