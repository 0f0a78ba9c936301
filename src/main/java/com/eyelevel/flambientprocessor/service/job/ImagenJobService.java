package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.job.CreateJobRequest;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import com.eyelevel.flambientprocessor.exception.JobNotFoundException;
import com.eyelevel.flambientprocessor.exception.JobStateException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.repository.ImagenJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Creates, looks up and cancels remote editing jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImagenJobService {

    private final ImagenJobRepository imagenJobRepository;
    private final FlambientProcessingConfig config;

    /**
     * Creates a {@code PENDING} job. The manifest is taken once here and never re-scanned.
     *
     * @throws InputValidationException if the input directory is missing or holds no images.
     */
    @Transactional
    public ImagenJob createJob(CreateJobRequest request) {
        Path inputDirectory = request.getInputDirectory();
        if (inputDirectory == null || !Files.isDirectory(inputDirectory)) {
            throw new InputValidationException("Input directory does not exist: " + inputDirectory);
        }
        List<String> manifest = request.getFiles() != null
                ? List.copyOf(request.getFiles())
                : discoverImages(inputDirectory, request.getPatterns());
        if (manifest.isEmpty()) {
            throw new InputValidationException("No image files found in " + inputDirectory);
        }

        Path outputDirectory = request.getOutputDirectory() != null
                ? request.getOutputDirectory()
                : defaultOutputDirectory(inputDirectory);

        ImagenJob job = new ImagenJob();
        job.setProjectName(request.getProjectName() != null
                                   ? request.getProjectName()
                                   : inputDirectory.getFileName().toString());
        job.setInputDirectory(inputDirectory.toAbsolutePath().toString());
        job.setOutputDirectory(outputDirectory.toAbsolutePath().toString());
        job.setProfileKey(request.getProfileKey() != null
                                  ? request.getProfileKey()
                                  : config.getImagen().getDefaultProfileKey());
        job.setPhotographyType(request.getPhotographyType());
        job.setEditOptions(request.getEditOptions() != null ? request.getEditOptions() : EditOptions.defaults());
        job.setFileManifest(new ArrayList<>(manifest));
        job.setTotalFiles(manifest.size());
        job.setSourceType(request.getSourceType());
        job.setParentJobId(request.getParentJobId());

        ImagenJob saved = imagenJobRepository.save(job);
        log.info("[job-{}] Created for {} files from {}", saved.getId(), saved.getTotalFiles(), inputDirectory);
        return saved;
    }

    /**
     * Resolves a full id or a unique leading fragment of one.
     *
     * @throws JobNotFoundException if nothing matches or the prefix is ambiguous.
     */
    @Transactional(readOnly = true)
    public ImagenJob findByIdPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new JobNotFoundException("A job id is required");
        }
        List<ImagenJob> matches = imagenJobRepository.findByIdStartingWith(prefix.trim());
        if (matches.isEmpty()) {
            throw new JobNotFoundException("Job not found: " + prefix);
        }
        if (matches.size() > 1) {
            throw new JobNotFoundException("Job id '" + prefix + "' is ambiguous, it matches " + matches.size()
                                           + " jobs");
        }
        return matches.get(0);
    }

    @Transactional(readOnly = true)
    public List<ImagenJob> listRecent() {
        return imagenJobRepository.findAllByOrderByCreatedAtDesc(
                PageRequest.of(0, Math.max(1, config.getWorkflow().getRecentJobLimit())));
    }

    @Transactional
    public ImagenJob cancel(ImagenJob job) {
        job.markCancelled();
        log.info("[job-{}] Cancelled", job.getId());
        return imagenJobRepository.save(job);
    }

    /**
     * Switches the editing profile of a job that is about to resume. The status is left as is, so
     * the run still continues from the step that stopped.
     *
     * @throws JobStateException if the job can no longer be resumed.
     */
    @Transactional
    public ImagenJob updateProfileForResume(ImagenJob job, String profileKey) {
        if (!job.canResume()) {
            throw new JobStateException("Job " + job.getId() + " is " + job.getStatus().getLabel()
                                        + " and cannot be resumed");
        }
        if (profileKey == null || profileKey.equals(job.getProfileKey())) {
            return job;
        }
        log.info("[job-{}] Profile changed from {} to {} for resume", job.getId(), job.getProfileKey(), profileKey);
        job.setProfileKey(profileKey);
        return imagenJobRepository.save(job);
    }

    /**
     * Jobs started from this one, e.g. a second editing pass over its results.
     */
    @Transactional(readOnly = true)
    public List<ImagenJob> findChildren(ImagenJob job) {
        return imagenJobRepository.findByParentJobId(job.getId());
    }

    /**
     * File names directly inside {@code directory} matching the comma-separated globs, or the
     * configured image extensions when no pattern is given. Sorted by name.
     */
    List<String> discoverImages(Path directory, String patterns) {
        Predicate<Path> filter = patterns == null || patterns.isBlank()
                ? extensionFilter(config.getWorkflow().getImagePatterns())
                : globFilter(patterns);
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile)
                          .filter(filter)
                          .map(path -> path.getFileName().toString())
                          .sorted()
                          .toList();
        } catch (IOException e) {
            throw new InputValidationException("Could not list " + directory + ": " + e.getMessage());
        }
    }

    /**
     * {@code /photos/shoot} becomes {@code /photos/shoot-edited}.
     */
    public static Path defaultOutputDirectory(Path inputDirectory) {
        Path absolute = inputDirectory.toAbsolutePath().normalize();
        return absolute.resolveSibling(absolute.getFileName() + "-edited");
    }

    private static Predicate<Path> extensionFilter(List<String> extensions) {
        List<String> lowered = extensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
        return path -> lowered.contains(
                FilenameUtils.getExtension(path.getFileName().toString()).toLowerCase(Locale.ROOT));
    }

    private static Predicate<Path> globFilter(String patterns) {
        List<PathMatcher> matchers = Arrays.stream(patterns.split(","))
                                           .map(String::trim)
                                           .filter(pattern -> !pattern.isEmpty())
                                           .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                                           .toList();
        return path -> matchers.stream().anyMatch(matcher -> matcher.matches(path.getFileName()));
    }
}
