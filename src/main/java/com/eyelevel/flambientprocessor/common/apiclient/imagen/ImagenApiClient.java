package com.eyelevel.flambientprocessor.common.apiclient.imagen;

import com.eyelevel.flambientprocessor.common.apiclient.ApiClient;
import com.eyelevel.flambientprocessor.common.apiclient.authentication.Authentication;
import com.eyelevel.flambientprocessor.common.apiclient.imagen.config.ImagenClientProperties;
import com.eyelevel.flambientprocessor.common.apiclient.model.ApiRequest;
import com.eyelevel.flambientprocessor.common.apiclient.model.ApiResponse;
import com.eyelevel.flambientprocessor.common.apiclient.model.HeaderConfig;
import com.eyelevel.flambientprocessor.common.json.JsonParser;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.dto.imagen.DownloadLink;
import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.ImagenProfile;
import com.eyelevel.flambientprocessor.dto.imagen.ImagenProject;
import com.eyelevel.flambientprocessor.dto.imagen.RemoteStatus;
import com.eyelevel.flambientprocessor.dto.imagen.UploadLink;
import com.eyelevel.flambientprocessor.dto.imagen.request.StartEditRequest;
import com.eyelevel.flambientprocessor.dto.imagen.request.UploadLinksRequest;
import com.eyelevel.flambientprocessor.dto.imagen.response.CreateProjectResponse;
import com.eyelevel.flambientprocessor.dto.imagen.response.DownloadLinksResponse;
import com.eyelevel.flambientprocessor.dto.imagen.response.ProfilesResponse;
import com.eyelevel.flambientprocessor.dto.imagen.response.StatusResponse;
import com.eyelevel.flambientprocessor.dto.imagen.response.UploadLinksResponse;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import com.eyelevel.flambientprocessor.exception.apiclient.ApiException;
import com.eyelevel.flambientprocessor.exception.apiclient.InternalServerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Client for the remote AI editing service: project lifecycle calls over the JSON API and raw
 * file transfers over the signed URLs the API hands out.
 *
 * <p>Every operation is retried on transient failures (429, 502-504, connection errors, timeouts)
 * through the injected {@link RetryTemplate}; any other failure is raised as the matching
 * {@link ApiException}.
 */
@Slf4j
@Service("imagenApiClient")
public class ImagenApiClient extends ApiClient {

    private final WebClient transferWebClient;
    private final JsonParser jsonParser;
    private final ImagenClientProperties.Endpoint endpoints;
    private final RetryTemplate retryTemplate;
    private final Duration transferTimeout;

    public ImagenApiClient(
            @Qualifier("imagenWebClient") final WebClient webClient,
            @Qualifier("imagenTransferWebClient") final WebClient transferWebClient,
            @Qualifier("imagenAuthentication") final Authentication authentication,
            @Qualifier("imagenHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Qualifier("imagenRetryTemplate") final RetryTemplate retryTemplate,
            final ImagenClientProperties properties,
            final FlambientProcessingConfig config
    ) {
        super(webClient, authentication, headerConfig,
              Duration.ofSeconds(config.getImagen().getRequestTimeoutSeconds()));
        this.transferWebClient = transferWebClient;
        this.jsonParser = jsonParser;
        this.endpoints = properties.getEndpoint();
        this.retryTemplate = retryTemplate;
        this.transferTimeout = Duration.ofSeconds(config.getImagen().getTransferTimeoutSeconds());
    }

    /**
     * Creates a remote project.
     *
     * @param name The project name; may be {@code null}.
     * @return the created project.
     */
    public ImagenProject createProject(final String name) {
        return execute("create-project", () -> {
            ApiRequest apiRequest = jsonRequest(HttpMethod.POST, endpoints.getCreateProject(), null,
                                                name == null ? Map.of() : Map.of("name", name));
            CreateProjectResponse response = parse(call(apiRequest), CreateProjectResponse.class);
            if (response.data() == null || response.data().uuid() == null) {
                throw new InternalServerException("Project creation response carried no project id");
            }
            log.info("Created remote project {}", response.data().uuid());
            return response.data();
        });
    }

    public List<ImagenProfile> getProfiles() {
        return execute("get-profiles", () -> {
            ApiRequest apiRequest = jsonRequest(HttpMethod.GET, endpoints.getProfiles(), null, null);
            return parse(call(apiRequest), ProfilesResponse.class).profiles();
        });
    }

    /**
     * Requests one signed upload link per file name.
     */
    public List<UploadLink> getUploadLinks(final String projectId, final List<String> filenames) {
        return execute("upload-links:" + projectId, () -> {
            ApiRequest apiRequest = jsonRequest(HttpMethod.POST, endpoints.getUploadLinks(), projectId,
                                                UploadLinksRequest.of(filenames));
            List<UploadLink> links = parse(call(apiRequest), UploadLinksResponse.class).links();
            log.debug("[{}] Received {} upload links for {} files", projectId, links.size(), filenames.size());
            return links;
        });
    }

    /**
     * PUTs the raw bytes of a local file to its signed URL. The URL is used verbatim and the request
     * carries no content type and no API key, since both would invalidate the signature.
     *
     * @throws InputValidationException if the local file is missing.
     */
    public void uploadFile(final UploadLink link, final Path localFile) {
        if (!Files.isRegularFile(localFile)) {
            throw new InputValidationException("File not found: " + localFile);
        }
        execute("upload:" + link.filename(), () -> {
            byte[] content = readAllBytes(localFile);
            transferWebClient.put()
                             .uri(URI.create(link.uploadUrl()))
                             .bodyValue(content)
                             .retrieve()
                             .toBodilessEntity()
                             .timeout(transferTimeout)
                             .onErrorMap(this::mapException)
                             .block();
            log.debug("Uploaded {} ({} bytes)", link.filename(), content.length);
            return null;
        });
    }

    /**
     * Submits the project for editing with the given profile.
     */
    public void startEditing(final String projectId, final String profileKey, final EditOptions options) {
        execute("start-edit:" + projectId, () -> {
            EditOptions effective = options == null ? EditOptions.defaults() : options;
            call(jsonRequest(HttpMethod.POST, endpoints.getStartEdit(), projectId,
                             StartEditRequest.of(profileKey, effective)));
            log.info("[{}] Submitted for editing with profile {}", projectId, profileKey);
            return null;
        });
    }

    /**
     * One-shot edit status query.
     */
    public RemoteStatus getEditStatus(final String projectId) {
        return execute("edit-status:" + projectId, () -> parse(
                call(jsonRequest(HttpMethod.GET, endpoints.getEditStatus(), projectId, null)),
                StatusResponse.class).status());
    }

    public void exportProject(final String projectId) {
        execute("export:" + projectId, () -> {
            call(jsonRequest(HttpMethod.POST, endpoints.getExport(), projectId, null));
            log.info("[{}] Export to JPEG requested", projectId);
            return null;
        });
    }

    public RemoteStatus getExportStatus(final String projectId) {
        return execute("export-status:" + projectId, () -> parse(
                call(jsonRequest(HttpMethod.GET, endpoints.getExportStatus(), projectId, null)),
                StatusResponse.class).status());
    }

    /**
     * Links to the exported JPEG files.
     */
    public List<DownloadLink> getExportLinks(final String projectId) {
        return execute("export-links:" + projectId, () -> parse(
                call(jsonRequest(HttpMethod.GET, endpoints.getExportLinks(), projectId, null)),
                DownloadLinksResponse.class).toLinks(DownloadLink.TYPE_JPEG));
    }

    /**
     * Links to the XMP edit sidecars.
     */
    public List<DownloadLink> getDownloadLinks(final String projectId) {
        return execute("download-links:" + projectId, () -> parse(
                call(jsonRequest(HttpMethod.GET, endpoints.getDownloadLinks(), projectId, null)),
                DownloadLinksResponse.class).toLinks(DownloadLink.TYPE_XMP));
    }

    /**
     * Streams a signed download to {@code destinationDirectory/filename}. The body is written to a
     * {@code .part} file first so an interrupted transfer never leaves a truncated result behind.
     *
     * @return the path of the written file.
     */
    public Path downloadFile(final DownloadLink link, final Path destinationDirectory) {
        String filename = link.filename();
        if (filename == null || filename.isBlank() || ".".equals(filename) || "..".equals(filename)) {
            throw new InputValidationException("Refusing to download to unsafe file name '" + filename + "'");
        }
        return execute("download:" + filename, () -> {
            Path target = destinationDirectory.resolve(filename);
            if (!target.normalize().startsWith(destinationDirectory.normalize())) {
                throw new InputValidationException("Refusing to download outside " + destinationDirectory + ": "
                                                   + filename);
            }
            Path partial = destinationDirectory.resolve(filename + ".part");
            try {
                Files.createDirectories(destinationDirectory);
                Flux<DataBuffer> body = transferWebClient.get()
                                                         .uri(URI.create(link.downloadUrl()))
                                                         .retrieve()
                                                         .bodyToFlux(DataBuffer.class);
                DataBufferUtils.write(body, partial, StandardOpenOption.CREATE,
                                      StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)
                               .timeout(transferTimeout)
                               .onErrorMap(this::mapException)
                               .block();
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
                return target;
            } catch (IOException e) {
                throw new InternalServerException("Could not write " + target + ": " + e.getMessage());
            } finally {
                deleteQuietly(partial);
            }
        });
    }

    private <T> T execute(final String operation, final Supplier<T> action) {
        try {
            return retryTemplate.execute(context -> {
                context.setAttribute(RetryContext.NAME, operation);
                return action.get();
            });
        } catch (final ApiException | InputValidationException e) {
            throw e;
        } catch (final Exception e) {
            log.error("An unexpected error occurred during remote operation {}", operation, e);
            throw new InternalServerException("Unexpected error during " + operation + ": " + e.getMessage());
        }
    }

    private <T> T parse(final ApiResponse apiResponse, final Class<T> type) {
        return jsonParser.parseObject(apiResponse.getData(), type);
    }

    private static ApiRequest jsonRequest(HttpMethod method, String path, String projectId, Object body) {
        return ApiRequest.builder()
                         .method(method)
                         .path(path)
                         .pathVariables(projectId == null ? null : Map.of("projectId", projectId))
                         .body(body)
                         .contentType(MediaType.APPLICATION_JSON)
                         .acceptMediaType(MediaType.APPLICATION_JSON)
                         .build();
    }

    private static byte[] readAllBytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new InternalServerException("Could not read " + file + ": " + e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete partial download {}", path, e);
        }
    }
}
