package com.eyelevel.flambientprocessor.service.job.step;

import com.eyelevel.flambientprocessor.dto.imagen.DownloadLink;
import com.eyelevel.flambientprocessor.dto.imagen.DownloadResult;
import com.eyelevel.flambientprocessor.exception.RemoteEditException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.service.imagen.TransferListener;
import com.eyelevel.flambientprocessor.service.job.JobExecutionContext;
import com.eyelevel.flambientprocessor.service.job.JobStep;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Downloads the exported JPEGs into {@code {output}/edited} and the XMP sidecars into
 * {@code {output}/xmp}, then completes the job.
 *
 * <p>Files already on disk count as downloaded, so a resumed step only fetches what is missing.
 * Individual download failures are recorded on the job; the job still completes as long as at
 * least one edited file is in place. Sidecars are best effort.
 */
@Slf4j
public class DownloadStep implements JobStep {

    public static final String EDITED_DIRECTORY = "edited";
    public static final String XMP_DIRECTORY = "xmp";

    @Override
    public ImagenJobStatus status() {
        return ImagenJobStatus.DOWNLOADING;
    }

    @Override
    public void execute(ImagenJob job, JobExecutionContext context) {
        Path outputDirectory = Path.of(job.getOutputDirectory());
        Path editedDirectory = outputDirectory.resolve(EDITED_DIRECTORY);

        List<DownloadLink> links = fetchExportLinks(job, context);

        job.resetDownloadProgress();
        List<DownloadLink> missing = new ArrayList<>();
        for (DownloadLink link : links) {
            if (Files.isRegularFile(editedDirectory.resolve(link.filename()))) {
                job.recordDownloadSuccess(link.filename());
            } else {
                missing.add(link);
            }
        }
        context.checkpoint(job);
        if (missing.size() < links.size()) {
            log.info("[job-{}] {} of {} edited files already present", job.getId(), links.size() - missing.size(),
                     links.size());
        }

        if (!missing.isEmpty()) {
            DownloadResult result = context.transferService().download(missing, editedDirectory, new TransferListener() {
                @Override
                public void onSuccess(String filename, int completed, int total) {
                    job.recordDownloadSuccess(filename);
                    context.checkpoint(job);
                    context.listener().downloadProgress(job, filename, job.getDownloadedFiles(), links.size());
                }

                @Override
                public void onFailure(String filename, Throwable error) {
                    job.recordDownloadFailure(filename);
                    context.checkpoint(job);
                }
            });
            log.info("[job-{}] Downloaded {}/{} edited files", job.getId(), result.succeeded().size(),
                     result.totalFiles());
        }

        if (job.getDownloadedFiles() == 0) {
            throw new RemoteEditException("None of the " + links.size() + " edited files could be downloaded");
        }
        if (!job.getFailedDownloads().isEmpty()) {
            log.warn("[job-{}] {} edited files could not be downloaded: {}", job.getId(),
                     job.getFailedDownloads().size(), job.getFailedDownloads());
        }

        downloadSidecars(job, context, outputDirectory.resolve(XMP_DIRECTORY));

        job.markComplete();
        context.checkpoint(job);
    }

    /**
     * The export link list can lag behind the export status, so an empty list is retried once
     * after a short delay.
     */
    private static List<DownloadLink> fetchExportLinks(ImagenJob job, JobExecutionContext context) {
        String projectId = job.getRemoteProjectId();
        List<DownloadLink> links = context.apiClient().getExportLinks(projectId);
        if (links.isEmpty()) {
            long delay = context.imagen().getExportLinkRetryDelaySeconds();
            log.warn("[job-{}] No export links yet, retrying in {}s", job.getId(), delay);
            context.pause(Duration.ofSeconds(delay));
            links = context.apiClient().getExportLinks(projectId);
        }
        if (links.isEmpty()) {
            throw new RemoteEditException("Export finished but no download links were returned");
        }
        return links;
    }

    private static void downloadSidecars(ImagenJob job, JobExecutionContext context, Path xmpDirectory) {
        try {
            List<DownloadLink> sidecars = context.apiClient().getDownloadLinks(job.getRemoteProjectId());
            if (sidecars.isEmpty()) {
                log.info("[job-{}] No XMP sidecars available", job.getId());
                return;
            }
            DownloadResult result = context.transferService().download(sidecars, xmpDirectory, TransferListener.NONE);
            log.info("[job-{}] Downloaded {}/{} XMP sidecars", job.getId(), result.succeeded().size(),
                     result.totalFiles());
        } catch (RuntimeException e) {
            log.warn("[job-{}] XMP sidecars could not be fetched, continuing without them", job.getId(), e);
        }
    }
}
