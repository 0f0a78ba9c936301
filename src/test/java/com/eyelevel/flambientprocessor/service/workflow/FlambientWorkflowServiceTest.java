package com.eyelevel.flambientprocessor.service.workflow;

import com.eyelevel.flambientprocessor.common.processexec.ProcessExecutor;
import com.eyelevel.flambientprocessor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.dto.workflow.FlambientRunRequest;
import com.eyelevel.flambientprocessor.exception.InputValidationException;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationRule;
import com.eyelevel.flambientprocessor.model.exposure.ExifValue;
import com.eyelevel.flambientprocessor.model.exposure.ExposureRecord;
import com.eyelevel.flambientprocessor.service.blend.BlendScriptSynthesizer;
import com.eyelevel.flambientprocessor.service.blend.BlendScriptWriter;
import com.eyelevel.flambientprocessor.service.blend.CompositingEngineRunner;
import com.eyelevel.flambientprocessor.service.classification.ExposureClassifier;
import com.eyelevel.flambientprocessor.service.classification.ExposureGrouper;
import com.eyelevel.flambientprocessor.service.exif.ExifExtractionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlambientWorkflowServiceTest {

    private static final LocalDateTime SHOOT_START = LocalDateTime.of(2024, 5, 14, 10, 0);

    @TempDir
    Path workDir;

    @Mock
    private ExifExtractionService exifExtractionService;
    @Mock
    private ProcessExecutor processExecutor;

    private FlambientWorkflowService workflowService;
    private Path input;

    @BeforeEach
    void setUp() throws Exception {
        FlambientProcessingConfig config = new FlambientProcessingConfig();
        workflowService = new FlambientWorkflowService(config, exifExtractionService, new ExposureClassifier(),
                                                       new ExposureGrouper(), new BlendScriptSynthesizer(),
                                                       new BlendScriptWriter(config),
                                                       new CompositingEngineRunner(config, processExecutor));
        input = Files.createDirectory(workDir.resolve("shoot"));
        for (String name : List.of("a1.jpg", "f1.jpg", "f2.jpg", "a2.jpg", "f3.jpg", "a3.jpg")) {
            Files.writeString(input.resolve(name), name);
        }
    }

    @Test
    @DisplayName("Exposures are grouped, one script is written per group and only complete groups are blended")
    void prepare_blendsCompleteGroups() throws Exception {
        when(exifExtractionService.extract(eq(input.toAbsolutePath()), any(ClassificationRule.class))).thenReturn(List.of(
                record("a1.jpg", 0, "16"), record("f1.jpg", 5, "0"), record("f2.jpg", 9, "0"),
                record("a2.jpg", 30, "16"), record("f3.jpg", 35, "0"), record("a3.jpg", 60, "16")));
        Path output = workDir.resolve("out");
        Path flambient = output.resolve(FlambientWorkflowService.FLAMBIENT_DIRECTORY);
        when(processExecutor.execute(anyList(), anyString(), anyLong(), eq("magick"))).thenAnswer(invocation -> {
            String group = ((String) invocation.getArgument(1)).substring("group-".length());
            Files.writeString(flambient.resolve("flambient_" + group + ".jpg"), "blended");
            return new ProcessResult(0, "", "");
        });

        FlambientRunResult result = workflowService.prepare(FlambientRunRequest.builder()
                                                                               .inputDirectory(input)
                                                                               .outputDirectory(output)
                                                                               .build());

        assertThat(result.groups()).hasSize(3);
        assertThat(result.statistics().groupsWithBoth()).isEqualTo(2);
        assertThat(result.statistics().groupsAmbientOnly()).isEqualTo(1);
        assertThat(result.scripts().groupScripts()).hasSize(3);
        assertThat(output.resolve(FlambientWorkflowService.SCRIPTS_DIRECTORY)
                         .resolve(BlendScriptWriter.MASTER_SCRIPT)).exists();
        assertThat(result.blendedFiles()).containsExactly("flambient_01.jpg", "flambient_02.jpg");
        assertThat(result.flambientDirectory()).isEqualTo(flambient.toAbsolutePath());
        verify(processExecutor, times(2)).execute(anyList(), anyString(), anyLong(), eq("magick"));
    }

    @Test
    @DisplayName("An input directory without JPG files is rejected before EXIF extraction")
    void prepare_rejectsDirectoryWithoutJpegs() throws Exception {
        Path empty = Files.createDirectory(workDir.resolve("raw-only"));
        Files.writeString(empty.resolve("a.cr2"), "raw");

        assertThatThrownBy(() -> workflowService.prepare(FlambientRunRequest.builder().inputDirectory(empty).build()))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("No JPG files found");
        verify(exifExtractionService, never()).extract(any(), any());
    }

    private static ExposureRecord record(String filename, int seconds, String flash) {
        return new ExposureRecord(Path.of(filename), filename, SHOOT_START.plusSeconds(seconds),
                                  Map.of("Flash", new ExifValue(flash, flash.equals("16") ? "No Flash" : "Fired")));
    }
}
