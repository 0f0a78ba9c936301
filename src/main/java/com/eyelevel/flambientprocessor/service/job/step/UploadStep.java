package com.eyelevel.flambientprocessor.service.job.step;

import com.eyelevel.flambientprocessor.dto.imagen.ImagenProject;
import com.eyelevel.flambientprocessor.dto.imagen.UploadResult;
import com.eyelevel.flambientprocessor.exception.RemoteEditException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.service.imagen.TransferListener;
import com.eyelevel.flambientprocessor.service.job.JobExecutionContext;
import com.eyelevel.flambientprocessor.service.job.JobStep;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Creates the remote project when the job has none yet and uploads every file not uploaded so far.
 * Each file outcome is checkpointed as it arrives, so a resumed job uploads only what is left.
 */
@Slf4j
public class UploadStep implements JobStep {

    @Override
    public ImagenJobStatus status() {
        return ImagenJobStatus.UPLOADING;
    }

    @Override
    public void execute(ImagenJob job, JobExecutionContext context) {
        if (job.getRemoteProjectId() == null) {
            ImagenProject project = context.apiClient().createProject(job.getProjectName());
            job.setRemoteProjectId(project.uuid());
            context.checkpoint(job);
            log.info("[job-{}] Remote project {} created", job.getId(), project.uuid());
        } else {
            log.info("[job-{}] Reusing remote project {}", job.getId(), job.getRemoteProjectId());
        }

        List<String> pending = job.getPendingUploads();
        if (pending.isEmpty()) {
            log.info("[job-{}] All {} files already uploaded", job.getId(), job.getTotalFiles());
        } else {
            log.info("[job-{}] Uploading {} of {} files", job.getId(), pending.size(), job.getTotalFiles());
            Path inputDirectory = Path.of(job.getInputDirectory());
            List<Path> files = pending.stream().map(inputDirectory::resolve).toList();
            UploadResult result = context.transferService().upload(job.getRemoteProjectId(), files,
                                                                   new CheckpointingListener(job, context));
            log.info("[job-{}] Upload batch finished: {}/{} succeeded ({}%)", job.getId(), result.succeeded().size(),
                     result.totalFiles(), Math.round(result.getSuccessRate()));
        }

        verifyUploads(job);
        job.markUploadsComplete();
        context.checkpoint(job);
    }

    private static void verifyUploads(ImagenJob job) {
        if (job.getUploadedFiles() == 0) {
            throw new RemoteEditException("No files were uploaded, nothing to edit");
        }
        List<String> failed = job.getFailedUploads();
        if (!failed.isEmpty()) {
            throw new RemoteEditException(failed.size() + " of " + job.getTotalFiles()
                                          + " uploads failed: " + String.join(", ", failed));
        }
    }

    private record CheckpointingListener(ImagenJob job, JobExecutionContext context) implements TransferListener {

        @Override
        public void onSuccess(String filename, int completed, int total) {
            job.recordUploadSuccess(filename);
            context.checkpoint(job);
            context.listener().uploadProgress(job, filename, job.getUploadedFiles(), job.getTotalFiles());
        }

        @Override
        public void onFailure(String filename, Throwable error) {
            job.recordUploadFailure(filename);
            context.checkpoint(job);
        }
    }
}
