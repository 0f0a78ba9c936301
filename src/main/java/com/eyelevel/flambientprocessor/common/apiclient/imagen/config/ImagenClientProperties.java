package com.eyelevel.flambientprocessor.common.apiclient.imagen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings of the remote editing API, bound from {@code app.imagen-client}.
 */
@Data
@ConfigurationProperties(prefix = "app.imagen-client")
public class ImagenClientProperties {

    private String baseurl = "https://api-beta.imagen-ai.com/v1";
    private String authKeyName = "x-api-key";
    private String authKeyValue;
    private Endpoint endpoint = new Endpoint();

    /**
     * Endpoint paths relative to {@link #baseurl}. {@code {projectId}} is expanded per call.
     */
    @Data
    public static class Endpoint {
        private String createProject = "/projects/";
        private String profiles = "/profiles";
        private String uploadLinks = "/projects/{projectId}/get_temporary_upload_links";
        private String startEdit = "/projects/{projectId}/edit";
        private String editStatus = "/projects/{projectId}/edit/status";
        private String export = "/projects/{projectId}/export";
        private String exportStatus = "/projects/{projectId}/export/status";
        private String exportLinks = "/projects/{projectId}/export/download";
        private String downloadLinks = "/projects/{projectId}/download";
    }
}
