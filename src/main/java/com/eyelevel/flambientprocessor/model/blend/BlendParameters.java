package com.eyelevel.flambientprocessor.model.blend;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.exception.InputValidationException;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Tunables of the blend recipe.
 *
 * @param levelLow           Black point of the blue-channel mask stretch, e.g. {@code 40%}.
 * @param levelHigh          White point of the mask stretch, e.g. {@code 140%}.
 * @param gamma              Gamma applied with the stretch, rendered as given.
 * @param outputPrefix       File name prefix of the blended outputs.
 * @param enableDarkenExport Whether to also export a darken-fold of the flash exposures.
 * @param darkenSuffix       Suffix of the darken export file name.
 */
public record BlendParameters(String levelLow, String levelHigh, String gamma, String outputPrefix,
                              boolean enableDarkenExport, String darkenSuffix) {

    private static final Pattern LEVEL = Pattern.compile("^-?\\d+(\\.\\d+)?%?$");

    public BlendParameters {
        requireLevel("level-low", levelLow);
        requireLevel("level-high", levelHigh);
        gamma = normalizeGamma(gamma);
        if (outputPrefix == null || outputPrefix.isBlank() || outputPrefix.contains("/")) {
            throw new InputValidationException("Invalid output prefix: " + outputPrefix);
        }
        darkenSuffix = darkenSuffix == null ? "" : darkenSuffix;
    }

    public static BlendParameters from(FlambientProcessingConfig.ImageMagick config) {
        return new BlendParameters(config.getLevelLow(), config.getLevelHigh(),
                                   BigDecimal.valueOf(config.getGamma()).toPlainString(), config.getOutputPrefix(),
                                   config.isEnableDarkenExport(), config.getDarkenSuffix());
    }

    /**
     * Applies operator overrides; {@code null} keeps the current value.
     */
    public BlendParameters withOverrides(String newLevelLow, String newLevelHigh, String newGamma) {
        return new BlendParameters(newLevelLow == null ? levelLow : newLevelLow,
                                   newLevelHigh == null ? levelHigh : newLevelHigh,
                                   newGamma == null ? gamma : newGamma, outputPrefix, enableDarkenExport,
                                   darkenSuffix);
    }

    private static void requireLevel(String name, String value) {
        if (value == null || !LEVEL.matcher(value.trim()).matches()) {
            throw new InputValidationException("Invalid " + name + " value '" + value + "', expected e.g. 40%");
        }
    }

    private static String normalizeGamma(String value) {
        try {
            double parsed = Double.parseDouble(value.trim());
            if (parsed <= 0) {
                throw new InputValidationException("Gamma must be positive, got " + value);
            }
            return value.trim();
        } catch (NumberFormatException | NullPointerException e) {
            throw new InputValidationException("Invalid gamma value '" + value + "'");
        }
    }
}
