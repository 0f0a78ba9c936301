package com.eyelevel.flambientprocessor.service.blend;

import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.exception.BlendScriptException;
import com.eyelevel.flambientprocessor.model.blend.BlendRecipe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes each recipe as {@code group_NN_script.mgk} and a master {@code run_all_scripts.sh} that
 * runs the engine once per blendable group and reports every group on its own.
 *
 * <p>Skipped groups still get a script file so the operator can see why they were left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlendScriptWriter {

    public static final String MASTER_SCRIPT = "run_all_scripts.sh";

    private final FlambientProcessingConfig config;

    public ScriptBundle write(List<BlendRecipe> recipes, Path scriptsDirectory) {
        try {
            Files.createDirectories(scriptsDirectory);
            List<GroupScript> scripts = new ArrayList<>(recipes.size());
            for (BlendRecipe recipe : recipes) {
                Path scriptPath = scriptsDirectory.resolve(scriptFileName(recipe.groupNumber()));
                Files.writeString(scriptPath, recipe.render(), StandardCharsets.UTF_8);
                scripts.add(new GroupScript(recipe.groupNumber(), scriptPath,
                                            recipe.isBlendable() ? recipe.outputPath() : null));
                if (!recipe.isBlendable()) {
                    log.warn("[group-{}] Skipped: {}", recipe.paddedGroupNumber(), recipe.skipReason().orElse(""));
                }
            }

            Path master = scriptsDirectory.resolve(MASTER_SCRIPT);
            Files.writeString(master, renderMasterScript(scripts), StandardCharsets.UTF_8);
            if (!master.toFile().setExecutable(true)) {
                log.warn("Could not mark {} as executable", master);
            }
            log.info("Wrote {} group scripts and {} to {}", scripts.size(), MASTER_SCRIPT, scriptsDirectory);
            return new ScriptBundle(scripts, master);
        } catch (IOException e) {
            throw new BlendScriptException("Could not write blend scripts to " + scriptsDirectory, e);
        }
    }

    public static String scriptFileName(int groupNumber) {
        return String.format("group_%02d_script.mgk", groupNumber);
    }

    String renderMasterScript(List<GroupScript> scripts) {
        String binary = config.getImagemagick().getBinary();
        List<GroupScript> blendable = scripts.stream().filter(GroupScript::isBlendable).toList();

        List<String> lines = new ArrayList<>();
        lines.add("#!/bin/bash");
        lines.add("");
        lines.add("# Runs every blendable group script through the compositing engine.");
        lines.add("");
        lines.add("echo \"Starting flambient processing for " + blendable.size() + " groups...\"");
        lines.add("");
        for (GroupScript script : blendable) {
            String group = script.paddedGroupNumber();
            lines.add("echo \"Processing group " + group + "...\"");
            lines.add(binary + " -script \"" + script.scriptPath() + "\"");
            lines.add("if [ $? -eq 0 ]; then");
            lines.add("    echo \"  Group " + group + " completed successfully.\"");
            lines.add("else");
            lines.add("    echo \"  Group " + group + " failed!\" >&2");
            lines.add("fi");
            lines.add("");
        }
        lines.add("echo \"All groups processed.\"");
        return String.join("\n", lines) + "\n";
    }
}
