package com.eyelevel.flambientprocessor.service.blend;

import com.eyelevel.flambientprocessor.common.processexec.ProcessExecutor;
import com.eyelevel.flambientprocessor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.flambientprocessor.config.FlambientProcessingConfig;
import com.eyelevel.flambientprocessor.exception.BlendScriptException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the compositing engine once per blendable group script. A failing group is recorded and the
 * batch moves on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompositingEngineRunner {

    private final FlambientProcessingConfig config;
    private final ProcessExecutor processExecutor;

    public CompositingReport runAll(ScriptBundle bundle) {
        List<CompositingReport.GroupOutcome> outcomes = new ArrayList<>();
        for (GroupScript script : bundle.blendable()) {
            outcomes.add(run(script));
        }
        CompositingReport report = new CompositingReport(outcomes);
        log.info("Compositing finished: {} succeeded, {} failed", report.succeeded().size(), report.failed().size());
        return report;
    }

    private CompositingReport.GroupOutcome run(GroupScript script) {
        FlambientProcessingConfig.ImageMagick imagemagick = config.getImagemagick();
        String contextInfo = "group-" + script.paddedGroupNumber();
        List<String> command = List.of(imagemagick.getBinary(), "-script", script.scriptPath().toString());
        try {
            ProcessResult result = processExecutor.execute(command, contextInfo, imagemagick.getTimeoutMinutes(),
                                                           "magick");
            if (!result.isSuccess()) {
                String error = "exit " + result.exitCode() + ": " + result.stderr();
                log.error("[{}] Compositing failed, {}", contextInfo, error);
                return new CompositingReport.GroupOutcome(script.groupNumber(), false, script.outputPath(), error);
            }
            if (!Files.isRegularFile(script.outputPath())) {
                log.error("[{}] Engine exited cleanly but {} is missing", contextInfo, script.outputPath());
                return new CompositingReport.GroupOutcome(script.groupNumber(), false, script.outputPath(),
                                                          "output not produced");
            }
            log.info("[{}] Blended into {}", contextInfo, script.outputPath().getFileName());
            return new CompositingReport.GroupOutcome(script.groupNumber(), true, script.outputPath(), null);
        } catch (IOException e) {
            log.error("[{}] Compositing could not run", contextInfo, e);
            return new CompositingReport.GroupOutcome(script.groupNumber(), false, script.outputPath(),
                                                      e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BlendScriptException("Compositing interrupted at " + contextInfo, e);
        }
    }
}
