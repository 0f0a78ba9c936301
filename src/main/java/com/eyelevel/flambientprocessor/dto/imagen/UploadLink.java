package com.eyelevel.flambientprocessor.dto.imagen;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A temporary signed URL that accepts the raw bytes of one file.
 *
 * @param filename  The file name the link was issued for.
 * @param uploadUrl The signed URL; must be used verbatim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadLink(
        @JsonProperty("file_name")
        String filename,

        @JsonProperty("upload_link")
        String uploadUrl
) {
}
