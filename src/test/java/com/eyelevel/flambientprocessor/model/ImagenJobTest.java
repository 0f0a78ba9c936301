package com.eyelevel.flambientprocessor.model;

import com.eyelevel.flambientprocessor.exception.JobStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImagenJobTest {

    static ImagenJob newJob(String... files) {
        ImagenJob job = new ImagenJob();
        job.setId("3f2a9c10-0000-4000-8000-000000000001");
        job.setInputDirectory("/shoot");
        job.setOutputDirectory("/shoot-edited");
        job.setProfileKey("309406");
        job.setFileManifest(new ArrayList<>(List.of(files)));
        job.setTotalFiles(files.length);
        return job;
    }

    @Test
    @DisplayName("Pending uploads are earlier failures followed by the never-attempted tail of the manifest")
    void getPendingUploads_failuresThenTail() {
        ImagenJob job = newJob("a.jpg", "b.jpg", "c.jpg", "d.jpg", "e.jpg");
        job.markStarted();
        job.recordUploadSuccess("a.jpg");
        job.recordUploadFailure("b.jpg");
        job.recordUploadSuccess("c.jpg");

        assertThat(job.getPendingUploads()).containsExactly("b.jpg", "d.jpg", "e.jpg");
        assertThat(job.getUploadProgress()).isEqualTo(40);
    }

    @Test
    @DisplayName("A retried upload that succeeds leaves the failed list")
    void recordUploadSuccess_clearsFailure() {
        ImagenJob job = newJob("a.jpg", "b.jpg");
        job.markStarted();
        job.recordUploadFailure("a.jpg");
        job.recordUploadFailure("a.jpg");
        job.recordUploadSuccess("b.jpg");
        job.recordUploadSuccess("a.jpg");

        assertThat(job.getFailedUploads()).isEmpty();
        assertThat(job.getUploadedFiles()).isEqualTo(2);
        assertThat(job.getPendingUploads()).isEmpty();
    }

    @Test
    @DisplayName("The forward chain runs from PENDING to COMPLETED")
    void transitions_forwardChain() {
        ImagenJob job = newJob("a.jpg");

        job.markStarted();
        job.markUploadsComplete();
        job.markProcessingComplete();
        job.markDownloading();
        job.markComplete();

        assertThat(job.getStatus()).isEqualTo(ImagenJobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(job.getDurationForHumans()).isPresent();
    }

    @Test
    @DisplayName("Skipping a step is rejected")
    void transitionTo_skipRejected() {
        ImagenJob job = newJob("a.jpg");
        job.markStarted();

        assertThatThrownBy(() -> job.transitionTo(ImagenJobStatus.EXPORTING)).isInstanceOf(JobStateException.class);
    }

    @Test
    @DisplayName("A failure keeps the running step and clears on re-entry")
    void markFailed_recordsStep() {
        ImagenJob job = newJob("a.jpg");
        job.markStarted();
        job.markUploadsComplete();

        job.markFailed("edit failed");

        assertThat(job.getStatus()).isEqualTo(ImagenJobStatus.FAILED);
        assertThat(job.getFailedStatus()).isEqualTo(ImagenJobStatus.PROCESSING);
        assertThat(job.getErrorMessage()).isEqualTo("edit failed");
        assertThat(job.canResume()).isTrue();

        job.transitionTo(ImagenJobStatus.PROCESSING);
        assertThat(job.getErrorMessage()).isNull();
    }

    @Test
    @DisplayName("A job failing before any step started resumes at upload")
    void markFailed_fromPending() {
        ImagenJob job = newJob("a.jpg");

        job.markFailed("no key");

        assertThat(job.getFailedStatus()).isEqualTo(ImagenJobStatus.UPLOADING);
    }

    @Test
    @DisplayName("Terminal jobs refuse every mutation")
    void terminalJob_isImmutable() {
        ImagenJob job = newJob("a.jpg");
        job.markCancelled();

        assertThat(job.canResume()).isFalse();
        assertThatThrownBy(job::markStarted).isInstanceOf(JobStateException.class);
        assertThatThrownBy(() -> job.markFailed("late")).isInstanceOf(JobStateException.class);
        assertThatThrownBy(() -> job.recordDownloadSuccess("a.jpg")).isInstanceOf(JobStateException.class);
        assertThatThrownBy(() -> job.updateProcessingProgress(50)).isInstanceOf(JobStateException.class);
    }

    @Test
    @DisplayName("Processing progress is clamped to 0..100")
    void updateProcessingProgress_clamps() {
        ImagenJob job = newJob("a.jpg");
        job.markStarted();
        job.markUploadsComplete();

        job.updateProcessingProgress(140);
        assertThat(job.getProgress()).isEqualTo(100);
        job.updateProcessingProgress(-3);
        assertThat(job.getProgress()).isZero();
    }
}
