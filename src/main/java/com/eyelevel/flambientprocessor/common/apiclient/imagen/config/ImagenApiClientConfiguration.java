package com.eyelevel.flambientprocessor.common.apiclient.imagen.config;

import com.eyelevel.flambientprocessor.common.apiclient.authentication.Authentication;
import com.eyelevel.flambientprocessor.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.flambientprocessor.common.apiclient.imagen.retry.ImagenApiRetryListener;
import com.eyelevel.flambientprocessor.common.apiclient.imagen.retry.TransientApiExceptionRetryPolicy;
import com.eyelevel.flambientprocessor.common.apiclient.model.HeaderConfig;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the beans of the remote editing API client: the {@link WebClient} for JSON calls, a
 * second bare {@link WebClient} for signed transfer URLs, the API-key {@link Authentication} and the
 * {@link RetryTemplate} that retries transient failures.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(ImagenClientProperties.class)
public class ImagenApiClientConfiguration {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    private final ImagenClientProperties properties;

    @Bean("imagenWebClient")
    public WebClient imagenWebClient() {
        log.info("Initializing remote editing WebClient with base URL: {}", properties.getBaseurl());
        return WebClient.builder()
                        .baseUrl(properties.getBaseurl())
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build();
    }

    /**
     * Signed URLs carry their own authorization, so this client has no base URL, no default headers
     * and never sees the API key.
     */
    @Bean("imagenTransferWebClient")
    public WebClient imagenTransferWebClient() {
        return WebClient.builder().build();
    }

    @Bean("imagenAuthentication")
    public Authentication imagenAuthentication() {
        APIKeyAuthentication authentication = new APIKeyAuthentication(properties.getAuthKeyName(),
                                                                       properties.getAuthKeyValue());
        if (!authentication.isConfigured()) {
            log.warn("Remote editing API key is not configured. Remote commands will fail authentication.");
        }
        return authentication;
    }

    @Bean("imagenHeader")
    public HeaderConfig imagenHeader() {
        return new HeaderConfig().addHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }

    @Bean("imagenRetryTemplate")
    public RetryTemplate imagenRetryTemplate(FlambientProcessingConfig config, ImagenApiRetryListener listener) {
        FlambientProcessingConfig.RetryConfig retry = config.getImagen().getRetry();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getDelayMs());
        backOffPolicy.setMultiplier(retry.getMultiplier());
        backOffPolicy.setMaxInterval(retry.getMaxDelayMs());

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new TransientApiExceptionRetryPolicy(retry.getAttempts() + 1));
        retryTemplate.setBackOffPolicy(backOffPolicy);
        retryTemplate.registerListener(listener);
        return retryTemplate;
    }
}
