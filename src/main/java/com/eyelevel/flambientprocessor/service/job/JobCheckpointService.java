package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.repository.ImagenJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists job progress immediately. Each checkpoint commits in its own transaction so a crash
 * or a failure later in the run never rolls back progress already made.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCheckpointService {

    private final ImagenJobRepository imagenJobRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ImagenJob checkpoint(ImagenJob job) {
        ImagenJob saved = imagenJobRepository.save(job);
        log.trace("[job-{}] Checkpoint: status={}, progress={}, uploaded={}/{}, downloaded={}", saved.getId(),
                  saved.getStatus(), saved.getProgress(), saved.getUploadedFiles(), saved.getTotalFiles(),
                  saved.getDownloadedFiles());
        return saved;
    }
}
