package com.eyelevel.flambientprocessor.model.exposure;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * The extracted metadata of one exposure. Immutable once built by the EXIF extraction step.
 *
 * @param sourcePath           The file as reported by the EXIF tool.
 * @param filename             The file name, the key used by groups and scripts.
 * @param timestamp            The capture time; {@code null} when the camera wrote none.
 * @param classificationFields Requested EXIF fields by tag name.
 */
public record ExposureRecord(Path sourcePath, String filename, LocalDateTime timestamp,
                             Map<String, ExifValue> classificationFields) {

    public ExposureRecord {
        classificationFields = Map.copyOf(classificationFields);
    }

    public Optional<ExifValue> field(String name) {
        return Optional.ofNullable(classificationFields.get(name));
    }

    public Optional<String> rawValue(String name) {
        return field(name).map(ExifValue::raw).filter(value -> !value.isBlank());
    }
}
