package com.eyelevel.flambientprocessor;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * The main entry point for the Flambient Processor command-line application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.processing" properties to
 *     {@link FlambientProcessingConfig}.</li>
 *     <li>{@link EnableJpaRepositories}: scans the job repositories.</li>
 * </ul>
 * The command runs inside the context; its outcome becomes the process exit code.
 */
@Slf4j
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.flambientprocessor.repository")
@EnableConfigurationProperties(value = FlambientProcessingConfig.class)
public class FlambientProcessorApplication {

    /**
     * Starts the context, runs the requested command and exits with its exit code.
     *
     * @param args Command name followed by {@code --option=value} arguments.
     */
    public static void main(final String[] args) {
        log.debug("Starting FlambientProcessorApplication...");
        final ConfigurableApplicationContext context = SpringApplication.run(FlambientProcessorApplication.class, args);
        System.exit(SpringApplication.exit(context));
    }
}
