package com.eyelevel.flambientprocessor.dto.workflow;

import com.eyelevel.flambientprocessor.model.exposure.ClassificationRule;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Input of one local flambient run. Level and gamma overrides are optional and fall back to the
 * configured ImageMagick defaults.
 */
@Value
@Builder
public class FlambientRunRequest {

    Path inputDirectory;
    Path outputDirectory;
    @Builder.Default
    ClassificationRule rule = ClassificationRule.defaultRule();
    String levelLow;
    String levelHigh;
    String gamma;
}
