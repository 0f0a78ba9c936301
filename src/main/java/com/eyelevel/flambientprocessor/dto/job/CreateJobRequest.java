package com.eyelevel.flambientprocessor.dto.job;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.PhotographyType;
import com.eyelevel.flambientprocessor.model.JobSourceType;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to create a remote editing job.
 *
 * <p>When {@code files} is set it becomes the manifest as given; otherwise the input directory is
 * scanned with {@code patterns} (comma-separated globs) or the configured image extensions.
 */
@Value
@Builder
public class CreateJobRequest {

    Path inputDirectory;
    Path outputDirectory;
    String projectName;
    String profileKey;
    PhotographyType photographyType;
    EditOptions editOptions;
    String patterns;
    List<String> files;
    @Builder.Default
    JobSourceType sourceType = JobSourceType.MANUAL;
    String parentJobId;
}
