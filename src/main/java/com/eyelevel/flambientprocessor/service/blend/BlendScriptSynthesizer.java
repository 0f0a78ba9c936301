package com.eyelevel.flambientprocessor.service.blend;

import com.eyelevel.flambientprocessor.model.blend.BlendInstruction;
import com.eyelevel.flambientprocessor.model.blend.BlendParameters;
import com.eyelevel.flambientprocessor.model.blend.BlendRecipe;
import com.eyelevel.flambientprocessor.model.exposure.ExposureGroup;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the compositing recipe that turns one ambient/flash group into a single blended exposure.
 *
 * <p>The recipe depends only on its arguments, so the same group and parameters always render to the
 * same script. The pipeline order is fixed:
 * <ol>
 *     <li>lighten-fold of the ambient exposures into {@code mpr:ambient_merge}</li>
 *     <li>lighten-fold of the flash exposures into {@code mpr:flash_merge}</li>
 *     <li>level stretch of the ambient merge's blue channel into {@code mpr:ambient_mask_alpha}</li>
 *     <li>flash through the mask, luminize, over, then colorize from the flash merge</li>
 *     <li>write {@code {prefix}_{NN}.jpg}</li>
 * </ol>
 */
@Component
public class BlendScriptSynthesizer {

    static final String AMBIENT_MERGE = "mpr:ambient_merge";
    static final String FLASH_MERGE = "mpr:flash_merge";
    static final String AMBIENT_MASK = "mpr:ambient_mask_alpha";
    static final String FLASH_MASK = "mpr:flash_mask";
    static final String LUMINIZE = "mpr:luminize_flambient";
    static final String UNGRADED = "mpr:ungraded_flambient";

    /**
     * @param group           The group to blend.
     * @param imageDirectory  Where the group's files live.
     * @param outputDirectory Where the blended image is written.
     * @param params          Mask and naming parameters.
     * @return a blendable recipe, or a skip recipe naming the missing side(s).
     */
    public BlendRecipe synthesize(ExposureGroup group, Path imageDirectory, Path outputDirectory,
                                  BlendParameters params) {
        List<BlendInstruction> instructions = new ArrayList<>(header(group));

        if (!group.hasBoth()) {
            instructions.add(BlendInstruction.skip(skipReason(group)));
            return new BlendRecipe(group.sequenceNumber(), instructions, null);
        }

        Path output = outputDirectory.resolve(outputFileName(group, params, ""));

        instructions.add(BlendInstruction.comment("Step 1: merge ambient exposures"));
        mergeInto(instructions, resolve(imageDirectory, group.ambientFiles()), "lighten", AMBIENT_MERGE);

        instructions.add(BlendInstruction.comment("Step 2: merge flash exposures"));
        mergeInto(instructions, resolve(imageDirectory, group.flashFiles()), "lighten", FLASH_MERGE);

        if (params.enableDarkenExport()) {
            Path darkened = outputDirectory.resolve(outputFileName(group, params, params.darkenSuffix()));
            instructions.add(BlendInstruction.comment("Darkened flash composite"));
            mergeInto(instructions, resolve(imageDirectory, group.flashFiles()), "darken", darkened.toString());
        }

        instructions.add(BlendInstruction.comment("Step 3: luminosity mask from the ambient blue channel"));
        instructions.add(BlendInstruction.load(AMBIENT_MERGE));
        instructions.add(BlendInstruction.channel("B"));
        instructions.add(BlendInstruction.level(params.levelLow(), params.levelHigh(), params.gamma()));
        instructions.add(BlendInstruction.resetChannel());
        writeAndDelete(instructions, AMBIENT_MASK);

        instructions.add(BlendInstruction.comment("Step 4: mask, luminize, over and colorize"));
        composite(instructions, FLASH_MERGE, AMBIENT_MASK, "CopyOpacity");
        writeAndDelete(instructions, FLASH_MASK);
        composite(instructions, FLASH_MERGE, AMBIENT_MERGE, "Luminize");
        writeAndDelete(instructions, LUMINIZE);
        composite(instructions, LUMINIZE, FLASH_MASK, "Over");
        writeAndDelete(instructions, UNGRADED);
        composite(instructions, UNGRADED, FLASH_MERGE, "Colorize");

        instructions.add(BlendInstruction.write(output.toString()));
        instructions.add(BlendInstruction.comment("Step 5: output " + output));

        return new BlendRecipe(group.sequenceNumber(), instructions, output);
    }

    public static String outputFileName(ExposureGroup group, BlendParameters params, String suffix) {
        return params.outputPrefix() + "_" + group.paddedNumber() + suffix + ".jpg";
    }

    private static List<BlendInstruction> header(ExposureGroup group) {
        return List.of(
                BlendInstruction.comment("Flambient blend script for group " + group.paddedNumber()),
                BlendInstruction.comment("Ambient files: " + listOrNone(group.ambientFiles())),
                BlendInstruction.comment("Flash files:   " + listOrNone(group.flashFiles())),
                BlendInstruction.comment(""));
    }

    private static String skipReason(ExposureGroup group) {
        if (!group.hasAmbient() && !group.hasFlash()) {
            return "group " + group.paddedNumber() + " has no ambient and no flash exposures";
        }
        String missing = group.hasAmbient() ? "flash" : "ambient";
        return "group " + group.paddedNumber() + " has no " + missing
               + " exposures; blending requires both ambient and flash";
    }

    private static void mergeInto(List<BlendInstruction> instructions, List<String> files, String operator,
                                  String target) {
        instructions.add(BlendInstruction.merge(operator, files));
        writeAndDelete(instructions, target);
    }

    private static void composite(List<BlendInstruction> instructions, String destination, String source,
                                  String operator) {
        instructions.add(BlendInstruction.load(destination, source));
        instructions.add(BlendInstruction.compose(operator));
    }

    private static void writeAndDelete(List<BlendInstruction> instructions, String target) {
        instructions.add(BlendInstruction.write(target));
        instructions.add(BlendInstruction.delete());
    }

    private static List<String> resolve(Path directory, List<String> files) {
        return files.stream().map(file -> directory.resolve(file).toString()).toList();
    }

    private static String listOrNone(List<String> files) {
        return files.isEmpty() ? "None" : String.join(", ", files);
    }
}
