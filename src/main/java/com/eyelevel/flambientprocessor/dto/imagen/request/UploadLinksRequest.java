package com.eyelevel.flambientprocessor.dto.imagen.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body asking for one signed upload link per file name.
 *
 * @param files The file names to upload.
 */
public record UploadLinksRequest(@JsonProperty("files_list") List<FileName> files) {

    public static UploadLinksRequest of(List<String> filenames) {
        return new UploadLinksRequest(filenames.stream().map(FileName::new).toList());
    }

    public record FileName(@JsonProperty("file_name") String fileName) {
    }
}
