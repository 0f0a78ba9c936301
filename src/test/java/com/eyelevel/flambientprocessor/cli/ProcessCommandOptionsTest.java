package com.eyelevel.flambientprocessor.cli;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.PhotographyType;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import com.eyelevel.flambientprocessor.model.JobSourceType;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationRule;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessCommandOptionsTest {

    private static ProcessCommandOptions parse(String... args) {
        return ProcessCommandOptions.parse(new DefaultApplicationArguments(args));
    }

    @Test
    @DisplayName("Without a command word the imagen command runs")
    void parse_defaultsToImagen() {
        ProcessCommandOptions options = parse("--input=/photos/shoot", "--profile=1234");

        assertThat(options.getCommand()).isEqualTo(ProcessCommandOptions.IMAGEN);
        assertThat(options.requireInput()).isEqualTo(Path.of("/photos/shoot"));
        assertThat(options.getProfile()).isEqualTo("1234");
    }

    @Test
    @DisplayName("Bare flags are true, explicit values are honoured")
    void parse_flags() {
        ProcessCommandOptions options = parse("imagen", "--crop", "--hdr=false", "--window-pull=false", "--dry-run");

        assertThat(options.getCrop()).isTrue();
        assertThat(options.getHdr()).isFalse();
        assertThat(options.getPerspective()).isNull();
        assertThat(options.isDryRun()).isTrue();
        assertThat(options.isYes()).isFalse();

        EditOptions editOptions = options.editOptions(EditOptions.defaults());
        assertThat(editOptions.isCrop()).isTrue();
        assertThat(editOptions.isWindowPull()).isFalse();
    }

    @Test
    @DisplayName("Window pull keeps its default when not given")
    void editOptions_windowPullDefault() {
        assertThat(parse("--input=/x").editOptions(EditOptions.defaults()).isWindowPull()).isTrue();
    }

    @Test
    @DisplayName("Only the flags that were given override the preset")
    void editOptions_overridesPreset() {
        EditOptions preset = EditOptions.builder()
                                        .hdrMerge(true)
                                        .straighten(true)
                                        .perspectiveCorrection(true)
                                        .photographyType(PhotographyType.WEDDING)
                                        .hdrOutputCompression("LOSSLESS")
                                        .build();

        EditOptions editOptions = parse("--input=/x", "--preset=wedding_hdr", "--hdr=false", "--type=real-estate")
                .editOptions(preset);

        assertThat(editOptions.isHdrMerge()).isFalse();
        assertThat(editOptions.getPhotographyType()).isEqualTo(PhotographyType.REAL_ESTATE);
        assertThat(editOptions.isStraighten()).isTrue();
        assertThat(editOptions.isPerspectiveCorrection()).isTrue();
        assertThat(editOptions.getHdrOutputCompression()).isEqualTo("LOSSLESS");
        assertThat(parse("--preset=wedding_hdr").getPreset()).isEqualTo("wedding_hdr");
    }

    @Test
    @DisplayName("The flambient command reads the strategy and its ambient value")
    void classificationRule_fromOptions() {
        ProcessCommandOptions options = parse("FLAMBIENT", "--input=/x", "--strategy=exposure-mode",
                                              "--ambient-value=0", "--sample=5", "--local");

        ClassificationRule rule = options.classificationRule();

        assertThat(options.getCommand()).isEqualTo(ProcessCommandOptions.FLAMBIENT);
        assertThat(rule.strategy()).isEqualTo(ClassificationStrategy.EXPOSURE_MODE);
        assertThat(rule.ambientValue()).isEqualTo("0");
        assertThat(options.getSample()).isEqualTo(5);
        assertThat(options.isLocal()).isTrue();
    }

    @Test
    @DisplayName("The flash strategy with its default ambient value applies when no strategy is given")
    void classificationRule_default() {
        ClassificationRule rule = parse("flambient").classificationRule();

        assertThat(rule.strategy()).isEqualTo(ClassificationStrategy.FLASH);
        assertThat(rule.ambientValue()).isEqualTo("16");
        assertThat(rule.exifField()).isEqualTo("Flash");
    }

    @Test
    @DisplayName("Invalid values are reported as input errors")
    void invalidValues() {
        assertThatThrownBy(() -> parse("flambient", "--strategy=aperture").classificationRule())
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("flash");
        assertThatThrownBy(() -> parse("--sample=ten")).isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> parse("--type=macro").photographyType()).isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> parse("--source=ftp").sourceType(JobSourceType.MANUAL))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> parse("imagen").requireInput()).isInstanceOf(InputValidationException.class);
    }

    @Test
    @DisplayName("Photography type and source accept loose spellings")
    void typeAndSource() {
        ProcessCommandOptions options = parse("--type=real-estate", "--source=flambient");

        assertThat(options.photographyType()).isEqualTo(PhotographyType.REAL_ESTATE);
        assertThat(options.sourceType(JobSourceType.MANUAL)).isEqualTo(JobSourceType.FLAMBIENT);
        assertThat(parse().sourceType(JobSourceType.PRODUCT)).isEqualTo(JobSourceType.PRODUCT);
    }
}
