package com.eyelevel.flambientprocessor.dto.imagen;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one download batch.
 *
 * @param totalFiles Links attempted in the batch.
 * @param succeeded  Local paths written.
 * @param failed     File names that could not be downloaded.
 */
public record DownloadResult(int totalFiles, List<Path> succeeded, List<String> failed) {

    public DownloadResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public boolean isFullySuccessful() {
        return failed.isEmpty();
    }

    public double getSuccessRate() {
        if (totalFiles == 0) {
            return 0.0;
        }
        return succeeded.size() * 100.0 / totalFiles;
    }
}
