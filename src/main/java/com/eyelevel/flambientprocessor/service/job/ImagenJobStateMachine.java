package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.common.apiclient.imagen.ImagenApiClient;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.exception.JobStateException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.service.imagen.ImagenTransferService;
import com.eyelevel.flambientprocessor.service.imagen.RemoteStatusPoller;
import com.eyelevel.flambientprocessor.service.job.step.DownloadStep;
import com.eyelevel.flambientprocessor.service.job.step.ExportStep;
import com.eyelevel.flambientprocessor.service.job.step.ProcessStep;
import com.eyelevel.flambientprocessor.service.job.step.UploadStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Drives an {@link ImagenJob} through upload, edit, export and download.
 *
 * <p>The run starts at the step matching the job's persisted status, so a job interrupted or
 * failed midway picks up where it stopped. A failure is never retried here: it is recorded on the
 * job, checkpointed, and the job is handed back for the operator to resume.
 */
@Slf4j
@Service
public class ImagenJobStateMachine {

    private final List<JobStep> steps = List.of(new UploadStep(), new ProcessStep(), new ExportStep(),
                                                new DownloadStep());

    private final FlambientProcessingConfig config;
    private final ImagenApiClient apiClient;
    private final ImagenTransferService transferService;
    private final RemoteStatusPoller poller;
    private final JobCheckpointService checkpoints;
    private final RemoteStatusPoller.Sleeper sleeper;

    @Autowired
    public ImagenJobStateMachine(FlambientProcessingConfig config, ImagenApiClient apiClient,
                                 ImagenTransferService transferService, RemoteStatusPoller poller,
                                 JobCheckpointService checkpoints) {
        this(config, apiClient, transferService, poller, checkpoints,
             duration -> Thread.sleep(duration.toMillis()));
    }

    public ImagenJobStateMachine(FlambientProcessingConfig config, ImagenApiClient apiClient,
                                 ImagenTransferService transferService, RemoteStatusPoller poller,
                                 JobCheckpointService checkpoints, RemoteStatusPoller.Sleeper sleeper) {
        this.config = config;
        this.apiClient = apiClient;
        this.transferService = transferService;
        this.poller = poller;
        this.checkpoints = checkpoints;
        this.sleeper = sleeper;
    }

    /**
     * Runs the job from its current step to completion.
     *
     * @return the same job, now {@code COMPLETED} or {@code FAILED}.
     * @throws JobStateException if the job is already completed or cancelled.
     */
    public ImagenJob run(ImagenJob job, JobProgressListener listener) {
        if (job.getStatus().isTerminal()) {
            throw new JobStateException("Job " + job.getId() + " is " + job.getStatus().getLabel()
                                        + " and cannot be run");
        }
        JobExecutionContext context = new JobExecutionContext(config, apiClient, transferService, poller,
                                                              checkpoints, listener, sleeper);
        int start = startIndex(job);
        log.info("[job-{}] Running from step {}/{} ({})", job.getId(), start + 1, steps.size(),
                 steps.get(start).status().getLabel());

        JobStep current = null;
        try {
            for (JobStep step : steps.subList(start, steps.size())) {
                current = step;
                enter(job, step);
                checkpoints.checkpoint(job);
                listener.stepStarted(job, step.status());
                step.execute(job, context);
                listener.stepCompleted(job, step.status());
            }
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("[job-{}] Failed during {}: {}", job.getId(),
                      current == null ? "startup" : current.status().getLabel(), message, e);
            job.markFailed(message);
            checkpoints.checkpoint(job);
            listener.jobFailed(job, e);
            return job;
        }

        log.info("[job-{}] Completed in {}", job.getId(), job.getDurationForHumans().orElse("-"));
        listener.jobCompleted(job);
        return job;
    }

    /**
     * Maps a persisted status to the step the run starts at.
     */
    int startIndex(ImagenJob job) {
        ImagenJobStatus status = job.getStatus();
        if (status == ImagenJobStatus.FAILED) {
            status = job.getFailedStatus() == null ? ImagenJobStatus.UPLOADING : job.getFailedStatus();
        }
        return switch (status) {
            case PROCESSING -> 1;
            case EXPORTING -> 2;
            case DOWNLOADING -> 3;
            default -> 0;
        };
    }

    private static void enter(ImagenJob job, JobStep step) {
        if (step.status() == ImagenJobStatus.UPLOADING) {
            job.markStarted();
        } else {
            job.transitionTo(step.status());
        }
    }
}
