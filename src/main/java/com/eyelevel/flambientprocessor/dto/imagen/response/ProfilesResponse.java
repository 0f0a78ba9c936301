package com.eyelevel.flambientprocessor.dto.imagen.response;

import com.eyelevel.flambientprocessor.dto.imagen.ImagenProfile;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProfilesResponse(Data data) {

    public List<ImagenProfile> profiles() {
        return data == null || data.profiles() == null ? List.of() : data.profiles();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(List<ImagenProfile> profiles) {
    }
}
