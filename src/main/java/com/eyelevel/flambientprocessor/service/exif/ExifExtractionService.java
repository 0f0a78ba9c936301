package com.eyelevel.flambientprocessor.service.exif;

import com.eyelevel.flambientprocessor.common.processexec.ProcessExecutor;
import com.eyelevel.flambientprocessor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.exception.ExifExtractionException;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationRule;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationStrategy;
import com.eyelevel.flambientprocessor.model.exposure.ExposureRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the capture metadata of every JPEG in a directory through the external EXIF tool.
 *
 * <p>The tool runs twice over the same files: once with {@code -n} for the raw numeric values the
 * classifier compares, once without it for the labels shown to the operator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExifExtractionService {

    static final List<String> STANDARD_FIELDS = List.of(
            "Filename", "DateTimeOriginal", "MeteringMode", "ShutterSpeed", "ApertureValue", "ISO",
            ClassificationStrategy.FLASH.getExifField(), "WhiteBalance", "ExposureProgram", "ExposureMode",
            "FNumber");

    private final FlambientProcessingConfig config;
    private final ProcessExecutor processExecutor;
    private final ExifCsvParser csvParser;

    /**
     * @param directory The image directory.
     * @param rule      The classification rule; a custom field is requested in addition.
     * @return one record per image in ascending capture order.
     * @throws ExifExtractionException if either run fails.
     */
    public List<ExposureRecord> extract(Path directory, ClassificationRule rule) {
        String contextInfo = "exif:" + directory.getFileName();
        log.info("[{}] Extracting EXIF metadata from {}", contextInfo, directory);

        String numericCsv = run(buildCommand(directory, rule, true), contextInfo, "numeric");
        String labelCsv = run(buildCommand(directory, rule, false), contextInfo, "label");

        List<ExposureRecord> records = csvParser.merge(numericCsv, labelCsv);
        log.info("[{}] Extracted metadata for {} images", contextInfo, records.size());
        return records;
    }

    /**
     * The first {@code sampleSize} records in capture order, shown to help pick a strategy.
     */
    public List<ExposureRecord> sample(Path directory, ClassificationRule rule, int sampleSize) {
        List<ExposureRecord> records = extract(directory, rule);
        return records.subList(0, Math.min(Math.max(sampleSize, 0), records.size()));
    }

    List<String> buildCommand(Path directory, ClassificationRule rule, boolean numeric) {
        FlambientProcessingConfig.Exif exif = config.getExif();
        List<String> command = new ArrayList<>();
        command.add(exif.getBinary());
        if (numeric) {
            command.add("-n");
        }
        command.add("-q");
        command.add("-csv");
        for (String extension : exif.getExtensions()) {
            command.add("-ext");
            command.add(extension);
        }
        STANDARD_FIELDS.forEach(field -> command.add("-" + field));
        if (rule != null && rule.strategy() == ClassificationStrategy.CUSTOM
            && !STANDARD_FIELDS.contains(rule.customField())) {
            command.add("-" + rule.customField());
        }
        command.add(directory.toAbsolutePath().toString());
        return command;
    }

    private String run(List<String> command, String contextInfo, String mode) {
        try {
            ProcessResult result = processExecutor.execute(command, contextInfo, config.getExif().getTimeoutMinutes(),
                                                           "exiftool", ProcessExecutor.UNBOUNDED_CAPTURE_BYTES);
            if (!result.isSuccess()) {
                throw new ExifExtractionException(String.format("EXIF %s extraction failed (exit %d): %s", mode,
                                                                result.exitCode(), result.stderr()));
            }
            return result.stdout();
        } catch (IOException e) {
            throw new ExifExtractionException("EXIF " + mode + " extraction could not run: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExifExtractionException("EXIF " + mode + " extraction was interrupted", e);
        }
    }
}
