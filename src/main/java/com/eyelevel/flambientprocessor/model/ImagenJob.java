package com.eyelevel.flambientprocessor.model;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.PhotographyType;
import com.eyelevel.flambientprocessor.exception.JobStateException;
import com.eyelevel.flambientprocessor.model.converter.EditOptionsConverter;
import com.eyelevel.flambientprocessor.model.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One end-to-end remote editing run with persisted, resumable progress.
 *
 * <p>The file manifest is a snapshot taken at creation and never re-scanned. Progress fields are
 * mutated only through the transition and bookkeeping methods below, which refuse to touch a
 * terminal job.
 */
@Entity
@Table(name = "imagen_job")
@Data
public class ImagenJob {

    @Id
    @Column(length = 36)
    private String id;

    @Column
    private String projectName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String inputDirectory;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String outputDirectory;

    /**
     * The remote project id, set once the project has been created.
     */
    @Column
    private String remoteProjectId;

    @Column(nullable = false)
    private String profileKey;

    @Enumerated(EnumType.STRING)
    @Column
    private PhotographyType photographyType;

    @Convert(converter = EditOptionsConverter.class)
    @Column(columnDefinition = "TEXT")
    private EditOptions editOptions;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ImagenJobStatus status = ImagenJobStatus.PENDING;

    /**
     * The running state the job was in when it failed; resume re-enters the pipeline there.
     */
    @Enumerated(EnumType.STRING)
    @Column
    private ImagenJobStatus failedStatus;

    @Column(nullable = false)
    private int progress;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> fileManifest = new ArrayList<>();

    @Column(nullable = false)
    private int totalFiles;

    @Column(nullable = false)
    private int uploadedFiles;

    @Column(nullable = false)
    private int downloadedFiles;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> failedUploads = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> failedDownloads = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobSourceType sourceType = JobSourceType.MANUAL;

    @Column(length = 36)
    private String parentJobId;

    private LocalDateTime startedAt;

    private LocalDateTime uploadCompletedAt;

    private LocalDateTime processingCompletedAt;

    private LocalDateTime completedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @PrePersist
    void assignId() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
    }

    // ----- derived state -----

    @Transient
    public boolean canResume() {
        return status.isResumable();
    }

    @Transient
    public boolean isComplete() {
        return status == ImagenJobStatus.COMPLETED;
    }

    @Transient
    public boolean isFailed() {
        return status == ImagenJobStatus.FAILED;
    }

    /**
     * Files still to upload: earlier failures first, then the part of the manifest never attempted.
     * Uploads are applied in manifest order, so the attempted files are always the first
     * {@code uploadedFiles + failedUploads.size()} manifest entries.
     */
    @Transient
    public List<String> getPendingUploads() {
        List<String> pending = new ArrayList<>(failedUploads);
        int attempted = uploadedFiles + failedUploads.size();
        if (attempted < fileManifest.size()) {
            pending.addAll(fileManifest.subList(attempted, fileManifest.size()));
        }
        return pending;
    }

    /**
     * @return uploaded files as a whole percentage of the manifest.
     */
    @Transient
    public int getUploadProgress() {
        if (totalFiles == 0) {
            return 0;
        }
        return (int) Math.round(uploadedFiles * 100.0 / totalFiles);
    }

    @Transient
    public Optional<Duration> getDuration() {
        if (startedAt == null) {
            return Optional.empty();
        }
        LocalDateTime end = completedAt == null ? LocalDateTime.now() : completedAt;
        return Optional.of(Duration.between(startedAt, end));
    }

    @Transient
    public Optional<String> getDurationForHumans() {
        return getDuration().map(duration -> {
            long seconds = duration.getSeconds();
            if (seconds < 60) {
                return seconds + "s";
            }
            long minutes = seconds / 60;
            if (minutes < 60) {
                return minutes + "m " + (seconds % 60) + "s";
            }
            return (minutes / 60) + "h " + (minutes % 60) + "m";
        });
    }

    // ----- transitions -----

    /**
     * Moves to {@code target}, enforcing the lifecycle rules of {@link ImagenJobStatus}.
     *
     * @throws JobStateException on an illegal move or a terminal job.
     */
    public void transitionTo(ImagenJobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new JobStateException("Job " + id + " cannot move from " + status + " to " + target);
        }
        if (target.isRunning() || target == ImagenJobStatus.PENDING) {
            errorMessage = null;
        }
        status = target;
    }

    public void markStarted() {
        transitionTo(ImagenJobStatus.UPLOADING);
        if (startedAt == null) {
            startedAt = LocalDateTime.now();
        }
    }

    public void markUploadsComplete() {
        transitionTo(ImagenJobStatus.PROCESSING);
        uploadCompletedAt = LocalDateTime.now();
    }

    public void updateProcessingProgress(int remoteProgress) {
        ensureMutable();
        progress = Math.max(0, Math.min(100, remoteProgress));
    }

    public void markProcessingComplete() {
        transitionTo(ImagenJobStatus.EXPORTING);
        processingCompletedAt = LocalDateTime.now();
    }

    public void markDownloading() {
        transitionTo(ImagenJobStatus.DOWNLOADING);
    }

    public void markComplete() {
        transitionTo(ImagenJobStatus.COMPLETED);
        progress = 100;
        completedAt = LocalDateTime.now();
    }

    /**
     * Records a failure. The step that was running is kept in {@link #failedStatus}; a job that
     * fails again while still {@code FAILED} keeps its earlier step.
     */
    public void markFailed(String message) {
        if (status.isRunning()) {
            failedStatus = status;
        } else if (status == ImagenJobStatus.PENDING) {
            failedStatus = ImagenJobStatus.UPLOADING;
        }
        transitionTo(ImagenJobStatus.FAILED);
        errorMessage = message;
    }

    public void markCancelled() {
        transitionTo(ImagenJobStatus.CANCELLED);
    }

    // ----- per-file bookkeeping -----

    public void recordUploadSuccess(String filename) {
        ensureMutable();
        failedUploads.remove(filename);
        uploadedFiles = Math.min(totalFiles, uploadedFiles + 1);
        progress = getUploadProgress();
    }

    public void recordUploadFailure(String filename) {
        ensureMutable();
        if (!failedUploads.contains(filename)) {
            failedUploads.add(filename);
        }
    }

    /**
     * Clears download bookkeeping before a (re-)run of the download step, which recounts files
     * already on disk.
     */
    public void resetDownloadProgress() {
        ensureMutable();
        downloadedFiles = 0;
        failedDownloads.clear();
    }

    public void recordDownloadSuccess(String filename) {
        ensureMutable();
        failedDownloads.remove(filename);
        downloadedFiles++;
    }

    public void recordDownloadFailure(String filename) {
        ensureMutable();
        if (!failedDownloads.contains(filename)) {
            failedDownloads.add(filename);
        }
    }

    private void ensureMutable() {
        if (status.isTerminal()) {
            throw new JobStateException("Job " + id + " is " + status + " and can no longer change");
        }
    }
}
