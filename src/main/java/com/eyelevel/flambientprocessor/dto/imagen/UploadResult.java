package com.eyelevel.flambientprocessor.dto.imagen;

import java.util.List;

/**
 * Outcome of one upload batch.
 *
 * @param totalFiles Files attempted in the batch.
 * @param succeeded  File names uploaded.
 * @param failed     File names that could not be uploaded.
 */
public record UploadResult(int totalFiles, List<String> succeeded, List<String> failed) {

    public UploadResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public boolean isFullySuccessful() {
        return failed.isEmpty();
    }

    /**
     * @return the percentage of attempted files that succeeded, {@code 0.0} for an empty batch.
     */
    public double getSuccessRate() {
        if (totalFiles == 0) {
            return 0.0;
        }
        return succeeded.size() * 100.0 / totalFiles;
    }
}
