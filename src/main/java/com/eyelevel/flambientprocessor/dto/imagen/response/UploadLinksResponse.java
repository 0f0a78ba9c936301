package com.eyelevel.flambientprocessor.dto.imagen.response;

import com.eyelevel.flambientprocessor.dto.imagen.UploadLink;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadLinksResponse(Data data) {

    public List<UploadLink> links() {
        return data == null || data.files() == null ? List.of() : data.files();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(@JsonProperty("files_list") List<UploadLink> files) {
    }
}
