package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.common.apiclient.imagen.ImagenApiClient;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.exception.RemoteEditException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.service.imagen.ImagenTransferService;
import com.eyelevel.flambientprocessor.service.imagen.RemoteStatusPoller;

import java.time.Duration;

/**
 * Collaborators handed to every {@link JobStep} for one run.
 */
public record JobExecutionContext(
        FlambientProcessingConfig config,
        ImagenApiClient apiClient,
        ImagenTransferService transferService,
        RemoteStatusPoller poller,
        JobCheckpointService checkpoints,
        JobProgressListener listener,
        RemoteStatusPoller.Sleeper sleeper
) {

    public FlambientProcessingConfig.Imagen imagen() {
        return config.getImagen();
    }

    public void checkpoint(ImagenJob job) {
        checkpoints.checkpoint(job);
    }

    public void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteEditException("Interrupted while waiting " + duration.toSeconds() + "s", e);
        }
    }
}
