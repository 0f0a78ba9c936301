package com.eyelevel.flambientprocessor.service.job.step;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.service.job.JobExecutionContext;
import com.eyelevel.flambientprocessor.service.job.JobStep;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Requests the JPEG export of the edited project and waits for it.
 */
@Slf4j
public class ExportStep implements JobStep {

    @Override
    public ImagenJobStatus status() {
        return ImagenJobStatus.EXPORTING;
    }

    @Override
    public void execute(ImagenJob job, JobExecutionContext context) {
        FlambientProcessingConfig.Imagen imagen = context.imagen();
        String projectId = job.getRemoteProjectId();

        context.apiClient().exportProject(projectId);
        context.poller().poll("export", () -> context.apiClient().getExportStatus(projectId),
                              Duration.ofSeconds(imagen.getExportPollIntervalSeconds()),
                              imagen.getExportPollMaxAttempts(),
                              percent -> context.listener().remoteProgress(job, ImagenJobStatus.EXPORTING, percent));

        log.info("[job-{}] Export finished", job.getId());
        job.markDownloading();
        context.checkpoint(job);
    }
}
