package com.eyelevel.flambientprocessor.dto.imagen;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A project created in the remote editing service.
 *
 * @param uuid The remote project id used by every subsequent call.
 * @param name The project name, when the service echoes it back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImagenProject(
        @JsonProperty(value = "project_uuid", required = true)
        String uuid,

        @JsonProperty("name")
        String name
) {
}
