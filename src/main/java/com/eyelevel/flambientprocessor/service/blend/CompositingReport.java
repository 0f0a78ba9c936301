package com.eyelevel.flambientprocessor.service.blend;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-group outcome of a compositing batch.
 */
public record CompositingReport(List<GroupOutcome> outcomes) {

    public CompositingReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<GroupOutcome> succeeded() {
        return outcomes.stream().filter(GroupOutcome::success).toList();
    }

    public List<GroupOutcome> failed() {
        return outcomes.stream().filter(outcome -> !outcome.success()).toList();
    }

    /**
     * @return the blended images produced, in group order.
     */
    public List<Path> outputs() {
        return succeeded().stream().map(GroupOutcome::outputPath).toList();
    }

    /**
     * @param groupNumber The group.
     * @param success     Whether the engine exited cleanly and produced the output.
     * @param outputPath  The expected output image.
     * @param error       The failure detail; {@code null} on success.
     */
    public record GroupOutcome(int groupNumber, boolean success, Path outputPath, String error) {
    }
}
