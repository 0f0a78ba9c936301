package com.eyelevel.flambientprocessor.dto.imagen.response;

import com.eyelevel.flambientprocessor.dto.imagen.ImagenProject;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateProjectResponse(ImagenProject data) {
}
