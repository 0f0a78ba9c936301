package com.eyelevel.flambientprocessor.model.exposure;

import java.util.List;

/**
 * One ambient burst followed by its flash burst, destined for a single blended output.
 *
 * @param sequenceNumber 1-based position in capture order.
 * @param ambientFiles   Ambient file names in capture order.
 * @param flashFiles     Flash file names in capture order.
 */
public record ExposureGroup(int sequenceNumber, List<String> ambientFiles, List<String> flashFiles) {

    public ExposureGroup {
        ambientFiles = List.copyOf(ambientFiles);
        flashFiles = List.copyOf(flashFiles);
    }

    public boolean hasBoth() {
        return !ambientFiles.isEmpty() && !flashFiles.isEmpty();
    }

    public boolean hasAmbient() {
        return !ambientFiles.isEmpty();
    }

    public boolean hasFlash() {
        return !flashFiles.isEmpty();
    }

    /**
     * @return the sequence number as used in file names, e.g. {@code 03}.
     */
    public String paddedNumber() {
        return String.format("%02d", sequenceNumber);
    }
}
