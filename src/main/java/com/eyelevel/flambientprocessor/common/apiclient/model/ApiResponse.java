package com.eyelevel.flambientprocessor.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * The raw outcome of a successful API call. Bodies are kept as bytes and bound to DTOs by the
 * concrete client.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * Response body; empty for bodiless 2xx responses.
     */
    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;
}
