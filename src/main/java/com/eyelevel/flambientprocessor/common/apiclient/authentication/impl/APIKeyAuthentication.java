package com.eyelevel.flambientprocessor.common.apiclient.authentication.impl;

import com.eyelevel.flambientprocessor.common.apiclient.authentication.Authentication;
import com.eyelevel.flambientprocessor.exception.apiclient.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * An implementation of {@link Authentication} that injects a static API key into request headers.
 *
 * <p>A missing key is reported at the first call instead of at startup, so commands that never reach
 * the remote service (local blending, job listing) run without one.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (!isConfigured()) {
            throw new UnauthorizedException(
                    "Remote editing API key is not configured. Set IMAGEN_AI_API_KEY in the environment.");
        }
        log.debug("Applying API key authentication using header: '{}'", headerName);
        headers.put(headerName, apiKey);
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "APIKeyAuthentication[headerName=" + headerName + "]";
    }
}
