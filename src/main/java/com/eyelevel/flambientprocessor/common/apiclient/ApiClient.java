package com.eyelevel.flambientprocessor.common.apiclient;

import com.eyelevel.flambientprocessor.common.apiclient.authentication.Authentication;
import com.eyelevel.flambientprocessor.common.apiclient.model.ApiRequest;
import com.eyelevel.flambientprocessor.common.apiclient.model.ApiResponse;
import com.eyelevel.flambientprocessor.common.apiclient.model.HeaderConfig;
import com.eyelevel.flambientprocessor.exception.apiclient.ApiException;
import com.eyelevel.flambientprocessor.exception.apiclient.BadGatewayException;
import com.eyelevel.flambientprocessor.exception.apiclient.BadRequestException;
import com.eyelevel.flambientprocessor.exception.apiclient.ConflictException;
import com.eyelevel.flambientprocessor.exception.apiclient.ForbiddenException;
import com.eyelevel.flambientprocessor.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.flambientprocessor.exception.apiclient.InternalServerException;
import com.eyelevel.flambientprocessor.exception.apiclient.NotFoundException;
import com.eyelevel.flambientprocessor.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.flambientprocessor.exception.apiclient.TooManyRequestsException;
import com.eyelevel.flambientprocessor.exception.apiclient.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for API clients, providing common functionality for making API calls,
 * handling responses, and mapping exceptions. Subclasses configure the {@link WebClient},
 * {@link Authentication}, and {@link HeaderConfig} and bind the raw response bytes to their DTOs.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;
    protected final Duration requestTimeout;

    /**
     * Executes one API call. Non-2xx responses and transport failures are raised as the matching
     * {@link ApiException} subclass.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The API response; never {@code null}.
     *
     * @throws ApiException If the call fails at any layer.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling API: {} {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(requestTimeout)
                                                     .onErrorMap(this::mapException)
                                                     .block();
            if (apiResponse == null) {
                throw new InternalServerException("Empty response from " + apiRequest.getPath());
            }
            log.debug("Received status {} from {}", apiResponse.getStatusCode(), apiRequest.getPath());
            return apiResponse;

        } catch (ApiException e) {
            log.warn("API call {} {} failed with status {}: {}", apiRequest.getMethod(), apiRequest.getPath(),
                     e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected failure during API call {} {}", apiRequest.getMethod(), apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    /**
     * Maps transport and HTTP failures to the {@link ApiException} hierarchy. Connection and timeout
     * failures become transient 503/504 exceptions.
     *
     * @param error The throwable error.
     *
     * @return A specific {@link ApiException} representing the error.
     */
    protected ApiException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException ||
            error instanceof UnknownHostException) {
            log.warn("Connection to remote service failed: {}", error.getMessage());
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            log.warn("Remote call timed out: {}", error.getMessage());
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(), error);
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value(), error);
    }

    /**
     * Creates the {@link ApiException} subclass matching an HTTP status code.
     *
     * @param body       The error message from the response body.
     * @param statusCode The HTTP status code.
     *
     * @return An {@link ApiException} representing the error.
     */
    protected ApiException createException(String body, int statusCode) {
        log.debug("Creating exception for status code: {}, body: {}", statusCode, body);
        return switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401 -> new UnauthorizedException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 429 -> new TooManyRequestsException(body);
            case 500 -> new InternalServerException(body);
            case 502 -> new BadGatewayException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());

            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));

            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Applies authentication, the client-wide {@link HeaderConfig} headers and the per-request
     * headers, in that order.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        apiRequest.getHeaders().forEach(requestBodySpec::header);

        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }

        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return handleSuccessResponse(response, statusCode);
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("HTTP " + statusCode)
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private Mono<ApiResponse> handleSuccessResponse(ClientResponse response, int statusCode) {
        HttpHeaders headers = response.headers().asHttpHeaders();
        Instant timestamp = Instant.now();

        return response.bodyToMono(byte[].class)
                       .defaultIfEmpty(new byte[0])
                       .map(data -> ApiResponse.builder()
                                               .data(data)
                                               .contentType(headers.getContentType())
                                               .headers(headers)
                                               .statusCode(statusCode)
                                               .timestamp(timestamp)
                                               .build())
                       .onErrorMap(error -> new ApiException("Error processing response: " + error.getMessage(),
                                                             statusCode, error));
    }
}
