package com.eyelevel.flambientprocessor.service.job.step;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.service.job.JobExecutionContext;
import com.eyelevel.flambientprocessor.service.job.JobStep;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Submits the project for editing and waits for the remote edit to finish.
 *
 * <p>The edit is always (re)submitted, including on resume, since a previous submission may never
 * have reached the service.
 */
@Slf4j
public class ProcessStep implements JobStep {

    @Override
    public ImagenJobStatus status() {
        return ImagenJobStatus.PROCESSING;
    }

    @Override
    public void execute(ImagenJob job, JobExecutionContext context) {
        FlambientProcessingConfig.Imagen imagen = context.imagen();
        String projectId = job.getRemoteProjectId();

        context.apiClient().startEditing(projectId, job.getProfileKey(), job.getEditOptions());
        job.updateProcessingProgress(0);
        context.checkpoint(job);

        int checkpointStep = Math.max(1, imagen.getProcessingCheckpointStep());
        int[] lastSaved = {0};
        context.poller().poll("edit", () -> context.apiClient().getEditStatus(projectId),
                              Duration.ofSeconds(imagen.getPollIntervalSeconds()), imagen.getPollMaxAttempts(),
                              percent -> {
                                  job.updateProcessingProgress(percent);
                                  context.listener().remoteProgress(job, ImagenJobStatus.PROCESSING, percent);
                                  if (percent - lastSaved[0] >= checkpointStep) {
                                      lastSaved[0] = percent;
                                      context.checkpoint(job);
                                  }
                              });

        log.info("[job-{}] Remote edit finished", job.getId());
        job.markProcessingComplete();
        context.checkpoint(job);
    }
}
