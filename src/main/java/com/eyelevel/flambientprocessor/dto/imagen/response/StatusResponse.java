package com.eyelevel.flambientprocessor.dto.imagen.response;

import com.eyelevel.flambientprocessor.dto.imagen.RemoteStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Envelope of the edit-status and export-status endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusResponse(RemoteStatus data) {

    public RemoteStatus status() {
        return data == null ? new RemoteStatus(null, null, null) : data;
    }
}
