package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.dto.job.CreateJobRequest;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import com.eyelevel.flambientprocessor.exception.JobNotFoundException;
import com.eyelevel.flambientprocessor.exception.JobStateException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import com.eyelevel.flambientprocessor.model.JobSourceType;
import com.eyelevel.flambientprocessor.repository.ImagenJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImagenJobServiceTest {

    @TempDir
    Path workDir;

    @Mock
    private ImagenJobRepository imagenJobRepository;

    private ImagenJobService jobService;
    private Path shoot;

    @BeforeEach
    void setUp() throws IOException {
        jobService = new ImagenJobService(imagenJobRepository, new FlambientProcessingConfig());
        shoot = Files.createDirectory(workDir.resolve("shoot"));
        for (String name : List.of("b.JPG", "a.jpg", "c.cr2", "notes.txt", "d.jpeg")) {
            Files.writeString(shoot.resolve(name), name);
        }
        Files.createDirectory(shoot.resolve("nested.jpg"));
    }

    @Test
    @DisplayName("Without patterns, discovery matches configured extensions case-insensitively and sorts by name")
    void discoverImages_defaultExtensions() {
        assertThat(jobService.discoverImages(shoot, null)).containsExactly("a.jpg", "b.JPG", "c.cr2", "d.jpeg");
    }

    @Test
    @DisplayName("Comma-separated globs replace the extension filter")
    void discoverImages_globs() {
        assertThat(jobService.discoverImages(shoot, "*.jpg, *.txt")).containsExactly("a.jpg", "notes.txt");
    }

    @Test
    @DisplayName("A new job snapshots the manifest and fills defaults")
    void createJob_fillsDefaults() {
        when(imagenJobRepository.save(any(ImagenJob.class))).then(returnsFirstArg());

        ImagenJob job = jobService.createJob(CreateJobRequest.builder().inputDirectory(shoot).build());

        assertThat(job.getStatus()).isEqualTo(ImagenJobStatus.PENDING);
        assertThat(job.getFileManifest()).containsExactly("a.jpg", "b.JPG", "c.cr2", "d.jpeg");
        assertThat(job.getTotalFiles()).isEqualTo(4);
        assertThat(job.getProjectName()).isEqualTo("shoot");
        assertThat(job.getProfileKey()).isEqualTo("309406");
        assertThat(job.getOutputDirectory()).isEqualTo(workDir.resolve("shoot-edited").toAbsolutePath().toString());
        assertThat(job.getEditOptions().isWindowPull()).isTrue();
        assertThat(job.getSourceType()).isEqualTo(JobSourceType.MANUAL);
    }

    @Test
    @DisplayName("An explicit file list is used as the manifest without scanning")
    void createJob_explicitFiles() {
        when(imagenJobRepository.save(any(ImagenJob.class))).then(returnsFirstArg());

        ImagenJob job = jobService.createJob(CreateJobRequest.builder()
                                                             .inputDirectory(shoot)
                                                             .files(List.of("flambient_01.jpg"))
                                                             .sourceType(JobSourceType.FLAMBIENT)
                                                             .parentJobId("parent-1")
                                                             .build());

        assertThat(job.getFileManifest()).containsExactly("flambient_01.jpg");
        assertThat(job.getSourceType()).isEqualTo(JobSourceType.FLAMBIENT);
        assertThat(job.getParentJobId()).isEqualTo("parent-1");
    }

    @Test
    @DisplayName("A missing input directory or an empty match is rejected before anything is saved")
    void createJob_rejectsInvalidInput() {
        assertThatThrownBy(() -> jobService.createJob(CreateJobRequest.builder()
                                                                      .inputDirectory(workDir.resolve("nope"))
                                                                      .build()))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("Input directory does not exist");
        assertThatThrownBy(() -> jobService.createJob(CreateJobRequest.builder()
                                                                      .inputDirectory(shoot)
                                                                      .patterns("*.png")
                                                                      .build()))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("No image files found");
        verify(imagenJobRepository, never()).save(any());
    }

    @Test
    @DisplayName("The default output directory is a sibling with an -edited suffix")
    void defaultOutputDirectory_sibling() {
        assertThat(ImagenJobService.defaultOutputDirectory(Path.of("/photos/shoot/")))
                .isEqualTo(Path.of("/photos/shoot-edited"));
    }

    @Test
    @DisplayName("A unique prefix resolves, an ambiguous or unknown one does not")
    void findByIdPrefix() {
        ImagenJob first = JobFixtures.job(shoot, shoot, "a.jpg");
        ImagenJob second = JobFixtures.job(shoot, shoot, "a.jpg");
        when(imagenJobRepository.findByIdStartingWith("9b1c")).thenReturn(List.of(first));
        when(imagenJobRepository.findByIdStartingWith("9")).thenReturn(List.of(first, second));
        when(imagenJobRepository.findByIdStartingWith("zz")).thenReturn(List.of());

        assertThat(jobService.findByIdPrefix(" 9b1c ")).isSameAs(first);
        assertThatThrownBy(() -> jobService.findByIdPrefix("9")).isInstanceOf(JobNotFoundException.class)
                                                                .hasMessageContaining("ambiguous");
        assertThatThrownBy(() -> jobService.findByIdPrefix("zz")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> jobService.findByIdPrefix(" ")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Resuming with another profile changes only the profile")
    void updateProfileForResume_changesProfileOnly() {
        ImagenJob job = JobFixtures.uploaded(shoot, shoot, "p-1", "a.jpg");
        job.markFailed("Remote edit failed");
        when(imagenJobRepository.save(job)).thenReturn(job);

        ImagenJob updated = jobService.updateProfileForResume(job, "77777");

        assertThat(updated.getProfileKey()).isEqualTo("77777");
        assertThat(updated.getStatus()).isEqualTo(ImagenJobStatus.FAILED);
        assertThat(updated.getFailedStatus()).isEqualTo(ImagenJobStatus.PROCESSING);
    }

    @Test
    @DisplayName("The same or no profile leaves the job untouched")
    void updateProfileForResume_sameProfile() {
        ImagenJob job = JobFixtures.job(shoot, shoot, "a.jpg");

        assertThat(jobService.updateProfileForResume(job, "309406")).isSameAs(job);
        assertThat(jobService.updateProfileForResume(job, null)).isSameAs(job);
        verify(imagenJobRepository, never()).save(any());
    }

    @Test
    @DisplayName("Completed jobs cannot be prepared for resume")
    void updateProfileForResume_terminal() {
        ImagenJob job = JobFixtures.job(shoot, shoot, "a.jpg");
        job.markCancelled();

        assertThatThrownBy(() -> jobService.updateProfileForResume(job, "77777"))
                .isInstanceOf(JobStateException.class);
    }

    @Test
    @DisplayName("Cancelling persists a CANCELLED job")
    void cancel_persists() {
        ImagenJob job = JobFixtures.job(shoot, shoot, "a.jpg");
        when(imagenJobRepository.save(job)).thenReturn(job);

        assertThat(jobService.cancel(job).getStatus()).isEqualTo(ImagenJobStatus.CANCELLED);
    }
}
