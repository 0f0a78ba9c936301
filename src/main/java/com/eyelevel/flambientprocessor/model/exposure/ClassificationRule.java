package com.eyelevel.flambientprocessor.model.exposure;

import com.eyelevel.flambientprocessor.exception.InputValidationException;

/**
 * A chosen strategy plus the exact raw value that marks an exposure as ambient.
 *
 * @param strategy     The classification strategy.
 * @param customField  The EXIF tag to read; only used by {@link ClassificationStrategy#CUSTOM}.
 * @param ambientValue The raw (numeric-mode) value that means ambient.
 */
public record ClassificationRule(ClassificationStrategy strategy, String customField, String ambientValue) {

    public ClassificationRule {
        if (strategy == null) {
            throw new InputValidationException("A classification strategy is required");
        }
        if (strategy == ClassificationStrategy.CUSTOM && (customField == null || customField.isBlank())) {
            throw new InputValidationException("The custom strategy requires an EXIF field name");
        }
        if (ambientValue == null || ambientValue.isBlank()) {
            throw new InputValidationException(
                    "No ambient value given for strategy '" + strategy.getKey() + "' and it has no default");
        }
        customField = customField == null ? null : customField.trim();
        ambientValue = ambientValue.trim();
    }

    /**
     * Builds a rule, falling back to the strategy's default ambient value when none is given.
     */
    public static ClassificationRule of(ClassificationStrategy strategy, String customField, String ambientValue) {
        String effective = ambientValue;
        if ((effective == null || effective.isBlank()) && strategy != null) {
            effective = strategy.getDefaultAmbientValue().orElse(null);
        }
        return new ClassificationRule(strategy, customField, effective);
    }

    public static ClassificationRule defaultRule() {
        return of(ClassificationStrategy.FLASH, null, null);
    }

    /**
     * @return the EXIF tag whose value is compared.
     */
    public String exifField() {
        return strategy == ClassificationStrategy.CUSTOM ? customField : strategy.getExifField();
    }
}
