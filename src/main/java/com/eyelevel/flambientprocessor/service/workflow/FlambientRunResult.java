package com.eyelevel.flambientprocessor.service.workflow;

import com.eyelevel.flambientprocessor.model.exposure.ExposureGroup;
import com.eyelevel.flambientprocessor.model.exposure.GroupStatistics;
import com.eyelevel.flambientprocessor.service.blend.CompositingReport;
import com.eyelevel.flambientprocessor.service.blend.ScriptBundle;

import java.nio.file.Path;
import java.util.List;

/**
 * What a local flambient run produced.
 *
 * @param outputDirectory    The run's output root.
 * @param flambientDirectory Where the blended images were written.
 * @param groups             The exposure groups, in capture order.
 * @param statistics         Counts over {@code groups}.
 * @param scripts            The written engine scripts.
 * @param compositing        Per-group engine outcomes.
 */
public record FlambientRunResult(Path outputDirectory, Path flambientDirectory, List<ExposureGroup> groups,
                                 GroupStatistics statistics, ScriptBundle scripts, CompositingReport compositing) {

    /**
     * @return file names of the blended images, relative to {@link #flambientDirectory()}.
     */
    public List<String> blendedFiles() {
        return compositing.outputs().stream().map(path -> path.getFileName().toString()).toList();
    }

    public boolean hasBlendedFiles() {
        return !compositing.succeeded().isEmpty();
    }
}
