package com.eyelevel.flambientprocessor.service.blend;

import com.eyelevel.flambientprocessor.model.blend.BlendInstruction;
import com.eyelevel.flambientprocessor.model.blend.BlendParameters;
import com.eyelevel.flambientprocessor.model.blend.BlendRecipe;
import com.eyelevel.flambientprocessor.model.blend.InstructionType;
import com.eyelevel.flambientprocessor.model.exposure.ExposureGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BlendScriptSynthesizerTest {

    private static final Path IMAGES = Path.of("/shoot");
    private static final Path OUTPUT = Path.of("/out/flambient");

    private final BlendScriptSynthesizer synthesizer = new BlendScriptSynthesizer();
    private final BlendParameters params = new BlendParameters("40%", "140%", "1.0", "flambient", false, "_tmp");

    @Test
    @DisplayName("Same group and parameters render byte-identical scripts")
    void synthesize_isDeterministic() {
        ExposureGroup group = new ExposureGroup(3, List.of("a1.jpg", "a2.jpg"), List.of("f1.jpg", "f2.jpg"));

        String first = synthesizer.synthesize(group, IMAGES, OUTPUT, params).render();
        String second = synthesizer.synthesize(group, IMAGES, OUTPUT, params).render();

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Blendable group follows the fixed mask pipeline and writes prefix_NN.jpg")
    void synthesize_rendersPipeline() {
        ExposureGroup group = new ExposureGroup(1, List.of("a1.jpg", "a2.jpg"), List.of("f1.jpg"));

        BlendRecipe recipe = synthesizer.synthesize(group, IMAGES, OUTPUT, params);
        List<String> lines = recipe.renderLines();

        assertThat(recipe.isBlendable()).isTrue();
        assertThat(recipe.outputPath()).isEqualTo(OUTPUT.resolve("flambient_01.jpg"));
        assertThat(lines.subList(0, 4)).containsExactly(
                "# Flambient blend script for group 01",
                "# Ambient files: a1.jpg, a2.jpg",
                "# Flash files:   f1.jpg",
                "");
        assertThat(lines).contains(
                "\"/shoot/a1.jpg\" \"/shoot/a2.jpg\" -compose lighten -composite -write mpr:ambient_merge +delete",
                "\"/shoot/f1.jpg\" -write mpr:flash_merge +delete",
                "mpr:ambient_merge -channel B -level 40%,140%,1.0 +channel -write mpr:ambient_mask_alpha +delete",
                "mpr:flash_merge mpr:ambient_mask_alpha -compose CopyOpacity -composite -write mpr:flash_mask +delete",
                "mpr:flash_merge mpr:ambient_merge -compose Luminize -composite -write mpr:luminize_flambient +delete",
                "mpr:luminize_flambient mpr:flash_mask -compose Over -composite -write mpr:ungraded_flambient +delete",
                "mpr:ungraded_flambient mpr:flash_merge -compose Colorize -composite -write \"/out/flambient/flambient_01.jpg\"");
        assertThat(recipe.render()).endsWith("# Step 5: output /out/flambient/flambient_01.jpg\n");
    }

    @Test
    @DisplayName("Group missing a side becomes a skip recipe without compositing instructions")
    void synthesize_skipsIncompleteGroup() {
        ExposureGroup group = new ExposureGroup(7, List.of("a1.jpg"), List.of());

        BlendRecipe recipe = synthesizer.synthesize(group, IMAGES, OUTPUT, params);

        assertThat(recipe.isBlendable()).isFalse();
        assertThat(recipe.output()).isEmpty();
        assertThat(recipe.instructions()).extracting(BlendInstruction::type)
                                         .noneMatch(InstructionType::isCompositing);
        assertThat(recipe.skipReason()).hasValueSatisfying(reason -> assertThat(reason).contains("no flash"));
        assertThat(recipe.render()).contains("# SKIP: group 07 has no flash exposures");
    }

    @Test
    @DisplayName("Darken export writes an extra flash composite with the suffix")
    void synthesize_darkenExport() {
        BlendParameters withDarken = new BlendParameters("40%", "140%", "1.0", "flambient", true, "_tmp");
        ExposureGroup group = new ExposureGroup(2, List.of("a.jpg"), List.of("f1.jpg", "f2.jpg"));

        String script = synthesizer.synthesize(group, IMAGES, OUTPUT, withDarken).render();

        assertThat(script).contains("\"/shoot/f1.jpg\" \"/shoot/f2.jpg\" -compose darken -composite "
                                    + "-write \"/out/flambient/flambient_02_tmp.jpg\" +delete");
    }

    @Test
    @DisplayName("Level overrides flow into the blue channel stretch")
    void synthesize_levelOverrides() {
        BlendParameters tuned = params.withOverrides("30%", "150%", "1.2");
        ExposureGroup group = new ExposureGroup(1, List.of("a.jpg"), List.of("f.jpg"));

        String script = synthesizer.synthesize(group, IMAGES, OUTPUT, tuned).render();

        assertThat(script).contains("-channel B -level 30%,150%,1.2 +channel");
    }
}
