package com.eyelevel.flambientprocessor.service.imagen;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig.EditPreset;
import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.PhotographyType;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Looks up the configured edit presets under {@code app.processing.imagen.presets}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EditPresetCatalog {

    private final FlambientProcessingConfig config;

    /**
     * Resolves {@code key}, or the configured default preset when {@code key} is null.
     *
     * @throws InputValidationException if an explicitly requested preset does not exist.
     */
    public EditOptions resolve(String key) {
        Map<String, EditPreset> presets = config.getImagen().getPresets();
        if (key == null) {
            String defaultKey = config.getImagen().getDefaultPreset();
            EditPreset preset = defaultKey == null ? null : presets.get(defaultKey);
            if (preset == null) {
                log.warn("Default edit preset '{}' is not configured, using window pull for real estate", defaultKey);
                return EditOptions.builder().photographyType(PhotographyType.REAL_ESTATE).build();
            }
            return preset.toEditOptions();
        }
        EditPreset preset = presets.get(key.trim());
        if (preset == null) {
            throw new InputValidationException("Unknown edit preset '" + key + "', expected one of " + keys());
        }
        log.debug("Using edit preset {} ({})", key, preset.getName());
        return preset.toEditOptions();
    }

    public Set<String> keys() {
        return config.getImagen().getPresets().keySet();
    }
}
