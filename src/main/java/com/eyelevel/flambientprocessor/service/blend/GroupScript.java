package com.eyelevel.flambientprocessor.service.blend;

import java.nio.file.Path;

/**
 * A written per-group engine script.
 *
 * @param groupNumber The group's sequence number.
 * @param scriptPath  The {@code group_NN_script.mgk} file.
 * @param outputPath  The image the script produces; {@code null} for a skipped group.
 */
public record GroupScript(int groupNumber, Path scriptPath, Path outputPath) {

    public boolean isBlendable() {
        return outputPath != null;
    }

    public String paddedGroupNumber() {
        return String.format("%02d", groupNumber);
    }
}
