package com.eyelevel.flambientprocessor.model.exposure;

/**
 * One EXIF field as extracted in both modes.
 *
 * @param raw   The numeric value, used for classification.
 * @param label The human-readable value, used for display only.
 */
public record ExifValue(String raw, String label) {
}
