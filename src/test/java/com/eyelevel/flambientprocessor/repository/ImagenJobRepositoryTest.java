package com.eyelevel.flambientprocessor.repository;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ImagenJobRepositoryTest {

    @Autowired
    private ImagenJobRepository imagenJobRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("A saved job reloads with its manifest, bookkeeping lists and edit options intact")
    void save_roundTripsConvertedColumns() {
        ImagenJob job = newJob("shoot");
        job.setEditOptions(EditOptions.builder().crop(true).windowPull(false).build());
        job.markStarted();
        job.recordUploadSuccess("a.jpg");
        job.recordUploadFailure("b.jpg");
        job.markFailed("1 of 3 uploads failed: b.jpg");

        String id = imagenJobRepository.save(job).getId();
        entityManager.flush();
        entityManager.clear();

        ImagenJob reloaded = imagenJobRepository.findById(id).orElseThrow();
        assertThat(reloaded.getFileManifest()).containsExactly("a.jpg", "b.jpg", "c.jpg");
        assertThat(reloaded.getFailedUploads()).containsExactly("b.jpg");
        assertThat(reloaded.getPendingUploads()).containsExactly("b.jpg", "c.jpg");
        assertThat(reloaded.getEditOptions().isCrop()).isTrue();
        assertThat(reloaded.getEditOptions().isWindowPull()).isFalse();
        assertThat(reloaded.getStatus()).isEqualTo(ImagenJobStatus.FAILED);
        assertThat(reloaded.getFailedStatus()).isEqualTo(ImagenJobStatus.UPLOADING);
        assertThat(reloaded.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Jobs are found by id prefix")
    void findByIdStartingWith() {
        ImagenJob saved = imagenJobRepository.save(newJob("one"));
        imagenJobRepository.save(newJob("two"));

        assertThat(imagenJobRepository.findByIdStartingWith(saved.getId().substring(0, 12)))
                .extracting(ImagenJob::getId)
                .containsExactly(saved.getId());
        assertThat(imagenJobRepository.findByIdStartingWith("")).hasSize(2);
    }

    @Test
    @DisplayName("Recent jobs are limited by the page size and children are found by parent id")
    void recentAndChildren() {
        ImagenJob parent = imagenJobRepository.save(newJob("parent"));
        ImagenJob child = newJob("child");
        child.setParentJobId(parent.getId());
        imagenJobRepository.save(child);
        imagenJobRepository.save(newJob("other"));

        assertThat(imagenJobRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, 2))).hasSize(2);
        assertThat(imagenJobRepository.findByParentJobId(parent.getId()))
                .extracting(ImagenJob::getProjectName)
                .containsExactly("child");
    }

    private static ImagenJob newJob(String name) {
        ImagenJob job = new ImagenJob();
        job.setProjectName(name);
        job.setInputDirectory("/photos/" + name);
        job.setOutputDirectory("/photos/" + name + "-edited");
        job.setProfileKey("309406");
        job.setFileManifest(new ArrayList<>(List.of("a.jpg", "b.jpg", "c.jpg")));
        job.setTotalFiles(3);
        return job;
    }
}
