package com.eyelevel.flambientprocessor.cli;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.PhotographyType;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import com.eyelevel.flambientprocessor.model.JobSourceType;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationRule;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationStrategy;
import lombok.Builder;
import lombok.Value;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Command-line options of the {@code imagen}, {@code flambient} and {@code profiles} commands.
 *
 * <p>Flags may be given bare ({@code --crop}) or with an explicit value ({@code --window-pull=false}).
 */
@Value
@Builder
public class ProcessCommandOptions {

    public static final String IMAGEN = "imagen";
    public static final String FLAMBIENT = "flambient";
    public static final String PROFILES = "profiles";

    String command;

    Path input;
    Path output;
    String profile;
    String projectName;
    String type;
    String preset;
    Boolean windowPull;
    Boolean crop;
    Boolean perspective;
    Boolean hdr;
    String pattern;
    String source;
    String parent;
    String resume;
    boolean list;
    String status;
    boolean dryRun;
    boolean yes;

    String strategy;
    String ambientValue;
    String customField;
    String levelLow;
    String levelHigh;
    String gamma;
    boolean local;
    Integer sample;

    public static ProcessCommandOptions parse(ApplicationArguments arguments) {
        List<String> commands = arguments.getNonOptionArgs();
        String command = commands.isEmpty() ? IMAGEN : commands.get(0).trim().toLowerCase(Locale.ROOT);
        return ProcessCommandOptions.builder()
                                    .command(command)
                                    .input(path(arguments, "input"))
                                    .output(path(arguments, "output"))
                                    .profile(value(arguments, "profile"))
                                    .projectName(value(arguments, "project-name"))
                                    .type(value(arguments, "type"))
                                    .preset(value(arguments, "preset"))
                                    .windowPull(optionalFlag(arguments, "window-pull"))
                                    .crop(optionalFlag(arguments, "crop"))
                                    .perspective(optionalFlag(arguments, "perspective"))
                                    .hdr(optionalFlag(arguments, "hdr"))
                                    .pattern(value(arguments, "pattern"))
                                    .source(value(arguments, "source"))
                                    .parent(value(arguments, "parent"))
                                    .resume(value(arguments, "resume"))
                                    .list(flag(arguments, "list"))
                                    .status(value(arguments, "status"))
                                    .dryRun(flag(arguments, "dry-run"))
                                    .yes(flag(arguments, "yes"))
                                    .strategy(value(arguments, "strategy"))
                                    .ambientValue(value(arguments, "ambient-value"))
                                    .customField(value(arguments, "custom-field"))
                                    .levelLow(value(arguments, "level-low"))
                                    .levelHigh(value(arguments, "level-high"))
                                    .gamma(value(arguments, "gamma"))
                                    .local(flag(arguments, "local"))
                                    .sample(integer(arguments, "sample"))
                                    .build();
    }

    /**
     * @throws InputValidationException if {@code --input} was not given.
     */
    public Path requireInput() {
        if (input == null) {
            throw new InputValidationException("--input=<directory> is required");
        }
        return input;
    }

    public PhotographyType photographyType() {
        if (type == null) {
            return null;
        }
        return PhotographyType.fromValue(type)
                              .orElseThrow(() -> new InputValidationException("Unknown photography type: " + type));
    }

    public JobSourceType sourceType(JobSourceType fallback) {
        if (source == null) {
            return fallback;
        }
        try {
            return JobSourceType.valueOf(source.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InputValidationException("Unknown source type: " + source);
        }
    }

    /**
     * Applies the edit flags given on the command line on top of {@code preset}. Flags that were
     * not given keep the preset's value.
     */
    public EditOptions editOptions(EditOptions preset) {
        EditOptions.EditOptionsBuilder builder = preset.toBuilder();
        if (windowPull != null) {
            builder.windowPull(windowPull);
        }
        if (crop != null) {
            builder.crop(crop);
        }
        if (perspective != null) {
            builder.perspectiveCorrection(perspective);
        }
        if (hdr != null) {
            builder.hdrMerge(hdr);
        }
        PhotographyType photographyType = photographyType();
        if (photographyType != null) {
            builder.photographyType(photographyType);
        }
        return builder.build();
    }

    public ClassificationRule classificationRule() {
        if (strategy == null) {
            return ClassificationRule.of(ClassificationStrategy.FLASH, customField, ambientValue);
        }
        ClassificationStrategy chosen = ClassificationStrategy.fromKey(strategy).orElseThrow(
                () -> new InputValidationException("Unknown strategy '" + strategy + "', expected one of "
                                                   + ClassificationStrategy.supportedKeys()));
        return ClassificationRule.of(chosen, customField, ambientValue);
    }

    private static String value(ApplicationArguments arguments, String name) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String raw = values.get(values.size() - 1);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static Path path(ApplicationArguments arguments, String name) {
        String raw = value(arguments, name);
        return raw == null ? null : Path.of(raw);
    }

    private static boolean flag(ApplicationArguments arguments, String name) {
        if (!arguments.containsOption(name)) {
            return false;
        }
        String raw = value(arguments, name);
        return raw == null || Boolean.parseBoolean(raw);
    }

    private static Boolean optionalFlag(ApplicationArguments arguments, String name) {
        return arguments.containsOption(name) ? flag(arguments, name) : null;
    }

    private static Integer integer(ApplicationArguments arguments, String name) {
        String raw = value(arguments, name);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new InputValidationException("Invalid number for --" + name + ": " + raw);
        }
    }
}
