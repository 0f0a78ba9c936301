package com.eyelevel.flambientprocessor.dto.imagen.response;

import com.eyelevel.flambientprocessor.dto.imagen.DownloadLink;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Envelope shared by the export-download (JPEG) and download (XMP) endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DownloadLinksResponse(Data data) {

    public List<DownloadLink> toLinks(String fileType) {
        if (data == null || data.files() == null) {
            return List.of();
        }
        return data.files().stream()
                   .map(file -> new DownloadLink(file.fileName(), file.downloadLink(), fileType))
                   .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(@JsonProperty("files_list") List<FileEntry> files) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileEntry(@JsonProperty("file_name") String fileName,
                            @JsonProperty("download_link") String downloadLink) {
    }
}
