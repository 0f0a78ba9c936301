package com.eyelevel.flambientprocessor.service.blend;

import java.nio.file.Path;
import java.util.List;

/**
 * All scripts written for one run: one per group plus the master runner.
 */
public record ScriptBundle(List<GroupScript> groupScripts, Path masterScript) {

    public ScriptBundle {
        groupScripts = List.copyOf(groupScripts);
    }

    public List<GroupScript> blendable() {
        return groupScripts.stream().filter(GroupScript::isBlendable).toList();
    }

    public List<Path> scriptPaths() {
        return groupScripts.stream().map(GroupScript::scriptPath).toList();
    }
}
