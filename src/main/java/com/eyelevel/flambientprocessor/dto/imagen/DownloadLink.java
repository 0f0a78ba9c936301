package com.eyelevel.flambientprocessor.dto.imagen;

import org.apache.commons.io.FilenameUtils;

/**
 * A signed URL for one edited result.
 *
 * @param filename    The file name to store the result under, reduced to its last path segment.
 * @param downloadUrl The signed URL.
 * @param fileType    {@code jpeg} for exported images, {@code xmp} for edit sidecars.
 */
public record DownloadLink(String filename, String downloadUrl, String fileType) {

    public static final String TYPE_JPEG = "jpeg";
    public static final String TYPE_XMP = "xmp";

    public DownloadLink {
        filename = FilenameUtils.getName(filename);
    }
}
