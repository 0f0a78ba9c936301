package com.eyelevel.flambientprocessor.model.exposure;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The EXIF field used to tell ambient exposures from flash exposures, together with its display
 * label, the operator help text and the value that usually marks an ambient shot.
 */
@Getter
public enum ClassificationStrategy {
    FLASH("Flash", "Flash", "16=No Flash, 0=Flash Fired", "16"),
    EXPOSURE_PROGRAM("ExposureProgram", "Exposure Program",
                     "0=Not Defined, 1=Manual, 2=Program AE, 3=Aperture-priority", "1"),
    EXPOSURE_MODE("ExposureMode", "Exposure Mode", "0=Auto, 1=Manual, 2=Auto Bracket", "1"),
    WHITE_BALANCE("WhiteBalance", "White Balance", "0=Auto, 1=Manual", "0"),
    ISO("ISO", "ISO", "Numeric ISO value, e.g. 100, 400", null),
    SHUTTER_SPEED("ShutterSpeed", "Shutter Speed", "Exposure time in seconds, e.g. 0.008, 1", null),
    /**
     * Any other EXIF field, named by the operator.
     */
    CUSTOM(null, "Custom Field", "Any EXIF tag name; the ambient value must match its numeric form", null);

    private final String exifField;
    private final String label;
    private final String helpText;
    private final String defaultAmbientValueRaw;

    ClassificationStrategy(String exifField, String label, String helpText, String defaultAmbientValueRaw) {
        this.exifField = exifField;
        this.label = label;
        this.helpText = helpText;
        this.defaultAmbientValueRaw = defaultAmbientValueRaw;
    }

    public Optional<String> getDefaultAmbientValue() {
        return Optional.ofNullable(defaultAmbientValueRaw);
    }

    /**
     * @return the command-line key, e.g. {@code exposure_program}.
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a command-line key. Dashes and underscores are interchangeable and case is ignored.
     */
    public static Optional<ClassificationStrategy> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(strategy -> strategy.name().equals(normalized)).findFirst();
    }

    public static String supportedKeys() {
        return Arrays.stream(values()).map(ClassificationStrategy::getKey).collect(Collectors.joining(", "));
    }
}
