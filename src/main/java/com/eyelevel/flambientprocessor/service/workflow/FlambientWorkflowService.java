package com.eyelevel.flambientprocessor.service.workflow;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.dto.workflow.FlambientRunRequest;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import com.eyelevel.flambientprocessor.model.blend.BlendParameters;
import com.eyelevel.flambientprocessor.model.blend.BlendRecipe;
import com.eyelevel.flambientprocessor.model.exposure.ClassifiedExposure;
import com.eyelevel.flambientprocessor.model.exposure.ExposureGroup;
import com.eyelevel.flambientprocessor.model.exposure.ExposureRecord;
import com.eyelevel.flambientprocessor.model.exposure.GroupStatistics;
import com.eyelevel.flambientprocessor.service.blend.BlendScriptSynthesizer;
import com.eyelevel.flambientprocessor.service.blend.BlendScriptWriter;
import com.eyelevel.flambientprocessor.service.blend.CompositingEngineRunner;
import com.eyelevel.flambientprocessor.service.blend.CompositingReport;
import com.eyelevel.flambientprocessor.service.blend.ScriptBundle;
import com.eyelevel.flambientprocessor.service.classification.ExposureClassifier;
import com.eyelevel.flambientprocessor.service.classification.ExposureGrouper;
import com.eyelevel.flambientprocessor.service.exif.ExifExtractionService;
import com.eyelevel.flambientprocessor.service.job.ImagenJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * The local half of a flambient run: read EXIF, classify and group the exposures, write one
 * blend script per group and run the compositing engine over them.
 *
 * <p>Handing the blended images to the remote editor is left to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlambientWorkflowService {

    public static final String SCRIPTS_DIRECTORY = "scripts";
    public static final String FLAMBIENT_DIRECTORY = "flambient";

    private final FlambientProcessingConfig config;
    private final ExifExtractionService exifExtractionService;
    private final ExposureClassifier exposureClassifier;
    private final ExposureGrouper exposureGrouper;
    private final BlendScriptSynthesizer blendScriptSynthesizer;
    private final BlendScriptWriter blendScriptWriter;
    private final CompositingEngineRunner compositingEngineRunner;

    /**
     * @throws InputValidationException if the input directory is missing or holds no JPEG files.
     */
    public FlambientRunResult prepare(FlambientRunRequest request) {
        Path inputDirectory = validateInput(request.getInputDirectory());
        Path outputDirectory = request.getOutputDirectory() != null
                ? request.getOutputDirectory().toAbsolutePath()
                : ImagenJobService.defaultOutputDirectory(inputDirectory);
        Path scriptsDirectory = outputDirectory.resolve(SCRIPTS_DIRECTORY);
        Path flambientDirectory = outputDirectory.resolve(FLAMBIENT_DIRECTORY);
        createDirectories(scriptsDirectory, flambientDirectory);

        BlendParameters params = BlendParameters.from(config.getImagemagick())
                                                .withOverrides(request.getLevelLow(), request.getLevelHigh(),
                                                               request.getGamma());

        List<ExposureRecord> records = exifExtractionService.extract(inputDirectory, request.getRule());
        List<ClassifiedExposure> classified = exposureClassifier.classify(records, request.getRule());
        List<ExposureGroup> groups = exposureGrouper.group(classified);
        GroupStatistics statistics = exposureGrouper.statistics(groups);
        log.info("Classified {} images into {} groups ({} ambient, {} flash, {} blendable)", records.size(),
                 statistics.totalGroups(), statistics.totalAmbient(), statistics.totalFlash(),
                 statistics.groupsWithBoth());

        List<BlendRecipe> recipes = groups.stream()
                                          .map(group -> blendScriptSynthesizer.synthesize(group, inputDirectory,
                                                                                          flambientDirectory, params))
                                          .toList();
        ScriptBundle scripts = blendScriptWriter.write(recipes, scriptsDirectory);
        CompositingReport compositing = compositingEngineRunner.runAll(scripts);

        return new FlambientRunResult(outputDirectory, flambientDirectory, groups, statistics, scripts, compositing);
    }

    private Path validateInput(Path inputDirectory) {
        if (inputDirectory == null || !Files.isDirectory(inputDirectory)) {
            throw new InputValidationException("Input directory does not exist: " + inputDirectory);
        }
        List<String> extensions = config.getExif().getExtensions().stream()
                                        .map(extension -> extension.toLowerCase(Locale.ROOT))
                                        .toList();
        try (Stream<Path> entries = Files.list(inputDirectory)) {
            boolean hasImages = entries.filter(Files::isRegularFile)
                                       .map(path -> FilenameUtils.getExtension(path.getFileName().toString()))
                                       .anyMatch(extension -> extensions.contains(extension.toLowerCase(Locale.ROOT)));
            if (!hasImages) {
                throw new InputValidationException("No JPG files found in " + inputDirectory);
            }
        } catch (IOException e) {
            throw new InputValidationException("Could not list " + inputDirectory + ": " + e.getMessage());
        }
        return inputDirectory.toAbsolutePath();
    }

    private static void createDirectories(Path... directories) {
        for (Path directory : directories) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new InputValidationException("Could not create " + directory + ": " + e.getMessage());
            }
        }
    }
}
