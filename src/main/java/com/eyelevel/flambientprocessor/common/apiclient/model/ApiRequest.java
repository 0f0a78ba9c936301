package com.eyelevel.flambientprocessor.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A single JSON call against the remote editing API.
 *
 * <p>Paths are relative to the client's base URL and may contain {@code {placeholders}} that are
 * expanded from {@link #pathVariables}.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Endpoint path template, e.g. {@code /projects/{projectId}/edit}.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Request headers. Authentication is applied into this map before the call is sent.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * JSON body, serialized by the WebClient codecs. {@code null} sends no body.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
