package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.common.apiclient.imagen.ImagenApiClient;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.dto.imagen.DownloadLink;
import com.eyelevel.flambientprocessor.dto.imagen.DownloadResult;
import com.eyelevel.flambientprocessor.dto.imagen.ImagenProject;
import com.eyelevel.flambientprocessor.dto.imagen.RemoteStatus;
import com.eyelevel.flambientprocessor.dto.imagen.UploadResult;
import com.eyelevel.flambientprocessor.exception.JobStateException;
import com.eyelevel.flambientprocessor.exception.apiclient.BadRequestException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.service.imagen.ImagenTransferService;
import com.eyelevel.flambientprocessor.service.imagen.RemoteStatusPoller;
import com.eyelevel.flambientprocessor.service.imagen.TransferListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImagenJobStateMachineTest {

    private static final String PROJECT = "p-1";
    private static final RemoteStatus DONE = new RemoteStatus("Completed", 100, null);

    @TempDir
    Path workDir;

    @Mock
    private ImagenApiClient apiClient;
    @Mock
    private ImagenTransferService transferService;
    @Mock
    private JobCheckpointService checkpoints;

    private ImagenJobStateMachine stateMachine;
    private final RecordingProgressListener listener = new RecordingProgressListener();

    @BeforeEach
    void setUp() {
        FlambientProcessingConfig config = new FlambientProcessingConfig();
        stateMachine = new ImagenJobStateMachine(config, apiClient, transferService,
                                                 new RemoteStatusPoller(duration -> {
                                                 }), checkpoints, duration -> {
        });
    }

    @Test
    @DisplayName("A job that failed after 3 of 5 uploads resumes by uploading exactly the 2 remaining files")
    void run_resumesPartialUpload() {
        ImagenJob job = JobFixtures.job(workDir, workDir.resolve("out"), "a.jpg", "b.jpg", "c.jpg", "d.jpg", "e.jpg");
        job.setRemoteProjectId(PROJECT);
        job.markStarted();
        job.recordUploadSuccess("a.jpg");
        job.recordUploadSuccess("b.jpg");
        job.recordUploadSuccess("c.jpg");
        job.markFailed("connection reset");

        List<List<Path>> uploadBatches = new ArrayList<>();
        when(transferService.upload(eq(PROJECT), anyList(), any())).thenAnswer(invocation -> {
            List<Path> files = invocation.getArgument(1);
            TransferListener transferListener = invocation.getArgument(2);
            uploadBatches.add(files);
            List<String> names = new ArrayList<>();
            for (Path file : files) {
                names.add(file.getFileName().toString());
                transferListener.onSuccess(file.getFileName().toString(), names.size(), files.size());
            }
            return new UploadResult(files.size(), names, List.of());
        });
        stubRemoteEditAndExport();
        stubDownloads("a.jpg", "b.jpg", "c.jpg", "d.jpg", "e.jpg");

        ImagenJob result = stateMachine.run(job, listener);

        assertThat(uploadBatches).containsExactly(List.of(workDir.resolve("d.jpg"), workDir.resolve("e.jpg")));
        assertThat(result.getStatus()).isEqualTo(ImagenJobStatus.COMPLETED);
        assertThat(result.getUploadedFiles()).isEqualTo(5);
        assertThat(result.getDownloadedFiles()).isEqualTo(5);
        assertThat(result.getErrorMessage()).isNull();
        verify(apiClient, never()).createProject(any());
        assertThat(listener.events).contains("upload d.jpg 4/5", "upload e.jpg 5/5")
                                   .endsWith("done DOWNLOADING", "completed");
    }

    @Test
    @DisplayName("A job that failed while processing resumes at processing and never uploads again")
    void run_resumesFromProcessing() {
        ImagenJob job = JobFixtures.uploaded(workDir, workDir.resolve("out"), PROJECT, "a.jpg", "b.jpg");
        job.markFailed("Remote edit failed: timeout");
        stubRemoteEditAndExport();
        stubDownloads("a.jpg", "b.jpg");

        ImagenJob result = stateMachine.run(job, listener);

        assertThat(result.getStatus()).isEqualTo(ImagenJobStatus.COMPLETED);
        verify(transferService, never()).upload(anyString(), anyList(), any());
        verify(apiClient, never()).createProject(any());
        verify(apiClient).startEditing(PROJECT, "309406", job.getEditOptions());
        assertThat(listener.events).startsWith("start PROCESSING");
    }

    @Test
    @DisplayName("A failing step records the message and the step, checkpoints, and returns the job")
    void run_recordsFailure() {
        ImagenJob job = JobFixtures.uploaded(workDir, workDir.resolve("out"), PROJECT, "a.jpg");
        when(apiClient.getEditStatus(PROJECT)).thenReturn(DONE);
        doThrow(new BadRequestException("export not allowed")).when(apiClient).exportProject(PROJECT);

        ImagenJob result = stateMachine.run(job, listener);

        assertThat(result.getStatus()).isEqualTo(ImagenJobStatus.FAILED);
        assertThat(result.getFailedStatus()).isEqualTo(ImagenJobStatus.EXPORTING);
        assertThat(result.getErrorMessage()).isEqualTo("export not allowed");
        assertThat(listener.failure).isInstanceOf(BadRequestException.class);
        assertThat(stateMachine.startIndex(result)).isEqualTo(2);
        verify(checkpoints, atLeastOnce()).checkpoint(job);
    }

    @Test
    @DisplayName("A new job creates the remote project and fails when any upload is missing")
    void run_newJobWithFailedUpload() {
        ImagenJob job = JobFixtures.job(workDir, workDir.resolve("out"), "a.jpg", "b.jpg");
        when(apiClient.createProject("Shoot")).thenReturn(new ImagenProject(PROJECT, "Shoot"));
        when(transferService.upload(eq(PROJECT), anyList(), any())).thenAnswer(invocation -> {
            TransferListener transferListener = invocation.getArgument(2);
            transferListener.onSuccess("a.jpg", 1, 2);
            transferListener.onFailure("b.jpg", new IllegalStateException("403"));
            return new UploadResult(2, List.of("a.jpg"), List.of("b.jpg"));
        });

        ImagenJob result = stateMachine.run(job, listener);

        assertThat(result.getRemoteProjectId()).isEqualTo(PROJECT);
        assertThat(result.getStatus()).isEqualTo(ImagenJobStatus.FAILED);
        assertThat(result.getFailedStatus()).isEqualTo(ImagenJobStatus.UPLOADING);
        assertThat(result.getErrorMessage()).isEqualTo("1 of 2 uploads failed: b.jpg");
        assertThat(result.getPendingUploads()).containsExactly("b.jpg");
        assertThat(result.getStartedAt()).isNotNull();
    }

    @Test
    @DisplayName("Completed and cancelled jobs cannot be run")
    void run_rejectsTerminalJobs() {
        ImagenJob job = JobFixtures.job(workDir, workDir.resolve("out"), "a.jpg");
        job.markCancelled();

        assertThatThrownBy(() -> stateMachine.run(job, listener)).isInstanceOf(JobStateException.class);
        verify(checkpoints, never()).checkpoint(any());
    }

    @Test
    @DisplayName("The start step follows the persisted status")
    void startIndex_followsStatus() {
        ImagenJob pending = JobFixtures.job(workDir, workDir, "a.jpg");
        assertThat(stateMachine.startIndex(pending)).isZero();

        ImagenJob downloading = JobFixtures.downloading(workDir, workDir, PROJECT, "a.jpg");
        assertThat(stateMachine.startIndex(downloading)).isEqualTo(3);

        ImagenJob failedWithoutStep = JobFixtures.job(workDir, workDir, "a.jpg");
        failedWithoutStep.setStatus(ImagenJobStatus.FAILED);
        assertThat(stateMachine.startIndex(failedWithoutStep)).isZero();
    }

    private void stubRemoteEditAndExport() {
        when(apiClient.getEditStatus(PROJECT)).thenReturn(new RemoteStatus("Processing", 50, null), DONE);
        when(apiClient.getExportStatus(PROJECT)).thenReturn(DONE);
    }

    private void stubDownloads(String... files) {
        List<DownloadLink> links = new ArrayList<>();
        for (String file : files) {
            links.add(new DownloadLink(file, "https://cdn/" + file, DownloadLink.TYPE_JPEG));
        }
        when(apiClient.getExportLinks(PROJECT)).thenReturn(links);
        when(apiClient.getDownloadLinks(PROJECT)).thenReturn(List.of());
        when(transferService.download(eq(links), any(), any())).thenAnswer(invocation -> {
            List<DownloadLink> requested = invocation.getArgument(0);
            Path directory = invocation.getArgument(1);
            TransferListener transferListener = invocation.getArgument(2);
            List<Path> written = new ArrayList<>();
            for (DownloadLink link : requested) {
                written.add(directory.resolve(link.filename()));
                transferListener.onSuccess(link.filename(), written.size(), requested.size());
            }
            return new DownloadResult(requested.size(), written, List.of());
        });
    }
}
