package com.eyelevel.flambientprocessor.cli;

import com.eyelevel.flambientprocessor.common.apiclient.imagen.ImagenApiClient;
import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.ImagenProfile;
import com.eyelevel.flambientprocessor.dto.job.CreateJobRequest;
import com.eyelevel.flambientprocessor.dto.workflow.FlambientRunRequest;
import com.eyelevel.flambientprocessor.exception.FlambientProcessingException;
import com.eyelevel.flambientprocessor.exception.apiclient.ApiException;
import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.JobSourceType;
import com.eyelevel.flambientprocessor.model.exposure.ClassificationRule;
import com.eyelevel.flambientprocessor.model.exposure.ExifValue;
import com.eyelevel.flambientprocessor.model.exposure.ExposureRecord;
import com.eyelevel.flambientprocessor.model.exposure.GroupStatistics;
import com.eyelevel.flambientprocessor.service.blend.CompositingReport;
import com.eyelevel.flambientprocessor.service.exif.ExifExtractionService;
import com.eyelevel.flambientprocessor.service.imagen.EditPresetCatalog;
import com.eyelevel.flambientprocessor.service.job.ImagenJobService;
import com.eyelevel.flambientprocessor.service.job.ImagenJobStateMachine;
import com.eyelevel.flambientprocessor.service.job.step.DownloadStep;
import com.eyelevel.flambientprocessor.service.workflow.FlambientRunResult;
import com.eyelevel.flambientprocessor.service.workflow.FlambientWorkflowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 *   imagen    [--input=DIR] [--output=DIR] [--profile=KEY] [--preset=KEY] ... | --resume=ID | --status=ID | --list
 *   flambient --input=DIR [--strategy=flash] [--ambient-value=16] [--local] [--sample=N] ...
 *   profiles
 * </pre>
 *
 * Exits with 0 on success and 1 on any failure. A failure after a job was created prints the job id
 * and how to resume it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProcessCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int SUCCESS = 0;
    static final int FAILURE = 1;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ImagenJobService imagenJobService;
    private final ImagenJobStateMachine stateMachine;
    private final FlambientWorkflowService flambientWorkflowService;
    private final ExifExtractionService exifExtractionService;
    private final ImagenApiClient imagenApiClient;
    private final EditPresetCatalog editPresetCatalog;
    private final OperatorConsole console;

    private int exitCode = SUCCESS;

    @Override
    public void run(ApplicationArguments arguments) {
        exitCode = execute(ProcessCommandOptions.parse(arguments));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ProcessCommandOptions options) {
        try {
            return switch (options.getCommand()) {
                case ProcessCommandOptions.IMAGEN -> runImagen(options);
                case ProcessCommandOptions.FLAMBIENT -> runFlambient(options);
                case ProcessCommandOptions.PROFILES -> listProfiles();
                default -> {
                    console.error("Unknown command '" + options.getCommand() + "', expected "
                                  + ProcessCommandOptions.IMAGEN + ", " + ProcessCommandOptions.FLAMBIENT + " or "
                                  + ProcessCommandOptions.PROFILES);
                    yield FAILURE;
                }
            };
        } catch (FlambientProcessingException | ApiException e) {
            log.debug("Command {} failed", options.getCommand(), e);
            console.error(e.getMessage());
            return FAILURE;
        }
    }

    // ----- imagen -----

    private int runImagen(ProcessCommandOptions options) {
        if (options.isList()) {
            return listJobs();
        }
        if (options.getStatus() != null) {
            return showStatus(imagenJobService.findByIdPrefix(options.getStatus()));
        }
        if (options.getResume() != null) {
            return resume(options);
        }

        EditOptions editOptions = options.editOptions(editPresetCatalog.resolve(options.getPreset()));
        ImagenJob job = imagenJobService.createJob(
                CreateJobRequest.builder()
                                .inputDirectory(options.requireInput())
                                .outputDirectory(options.getOutput())
                                .projectName(options.getProjectName())
                                .profileKey(options.getProfile())
                                .photographyType(editOptions.getPhotographyType())
                                .editOptions(editOptions)
                                .patterns(options.getPattern())
                                .sourceType(options.sourceType(JobSourceType.MANUAL))
                                .parentJobId(options.getParent())
                                .build());
        return launch(job, options);
    }

    private int resume(ProcessCommandOptions options) {
        ImagenJob job = imagenJobService.findByIdPrefix(options.getResume());
        if (!job.canResume()) {
            console.error("Job cannot be resumed (status: " + job.getStatus().getLabel() + ")");
            return FAILURE;
        }
        job = imagenJobService.updateProfileForResume(job, options.getProfile());

        console.info("Resuming job: " + job.getId());
        console.note("Project: " + job.getProjectName());
        console.note("Status: " + job.getStatus().getLabel()
                     + (job.getFailedStatus() != null && job.isFailed()
                                ? " (at " + job.getFailedStatus().getLabel() + ")"
                                : ""));
        console.note("Progress: " + job.getUploadedFiles() + "/" + job.getTotalFiles() + " uploaded");
        if (job.getErrorMessage() != null) {
            console.note("Last error: " + job.getErrorMessage());
        }
        if (!options.isYes() && !console.confirm("Resume this job?", true)) {
            return SUCCESS;
        }
        return runJob(job);
    }

    /**
     * Shows the summary, then either cancels (dry run or declined) or runs the new job.
     */
    private int launch(ImagenJob job, ProcessCommandOptions options) {
        printSummary(job);
        if (options.isDryRun()) {
            imagenJobService.cancel(job);
            console.info("Dry run, nothing was uploaded. Job " + job.getId() + " cancelled.");
            return SUCCESS;
        }
        if (!options.isYes() && !console.confirm("Start processing?", true)) {
            imagenJobService.cancel(job);
            console.info("Operation cancelled.");
            return SUCCESS;
        }
        return runJob(job);
    }

    private int runJob(ImagenJob job) {
        ImagenJob result = stateMachine.run(job, new ConsoleProgressListener(console));
        if (!result.isComplete()) {
            console.note("Job saved. Resume with: --resume=" + result.getId());
            return FAILURE;
        }
        printResults(result);
        return SUCCESS;
    }

    private int listJobs() {
        List<ImagenJob> jobs = imagenJobService.listRecent();
        if (jobs.isEmpty()) {
            console.info("No jobs yet.");
            return SUCCESS;
        }
        console.info(String.format("%-8s  %-24s  %-12s  %-9s  %s", "ID", "Project", "Status", "Files", "Created"));
        for (ImagenJob job : jobs) {
            console.info(String.format("%-8s  %-24s  %-12s  %4d/%-4d  %s", shortId(job),
                                       abbreviate(job.getProjectName(), 24), job.getStatus().getLabel(),
                                       job.getUploadedFiles(), job.getTotalFiles(),
                                       job.getCreatedAt() == null ? "-" : TIMESTAMP.format(job.getCreatedAt())));
        }
        return SUCCESS;
    }

    private int showStatus(ImagenJob job) {
        console.info("Job " + job.getId());
        console.note("Project: " + job.getProjectName());
        console.note("Status: " + job.getStatus().getLabel() + " (" + job.getProgress() + "%)");
        console.note("Source: " + job.getSourceType() + (job.getParentJobId() == null
                                                                  ? ""
                                                                  : ", parent " + job.getParentJobId()));
        console.note("Profile: " + job.getProfileKey());
        console.note("Remote project: " + (job.getRemoteProjectId() == null ? "-" : job.getRemoteProjectId()));
        console.note("Uploaded: " + job.getUploadedFiles() + "/" + job.getTotalFiles()
                     + (job.getFailedUploads().isEmpty() ? "" : ", failed " + job.getFailedUploads()));
        console.note("Downloaded: " + job.getDownloadedFiles()
                     + (job.getFailedDownloads().isEmpty() ? "" : ", failed " + job.getFailedDownloads()));
        job.getDurationForHumans().ifPresent(duration -> console.note("Duration: " + duration));
        if (job.getErrorMessage() != null) {
            console.note("Error: " + job.getErrorMessage());
        }
        imagenJobService.findChildren(job)
                        .forEach(child -> console.note("Follow-up job: " + child.getId() + " ("
                                                       + child.getStatus().getLabel() + ")"));
        if (job.canResume() && !job.getStatus().isRunning()) {
            console.note("Resume with: --resume=" + shortId(job));
        }
        return SUCCESS;
    }

    private void printSummary(ImagenJob job) {
        EditOptions editOptions = job.getEditOptions();
        console.info("Job " + job.getId());
        console.note("Input: " + job.getInputDirectory() + " (" + job.getTotalFiles() + " files)");
        console.note("Output: " + Path.of(job.getOutputDirectory()).resolve(DownloadStep.EDITED_DIRECTORY));
        console.note("Project: " + job.getProjectName());
        console.note("Profile: " + job.getProfileKey());
        if (job.getPhotographyType() != null) {
            console.note("Type: " + job.getPhotographyType().getLabel());
        }
        console.note("Window pull: " + yesNo(editOptions.isWindowPull()) + ", crop: " + yesNo(editOptions.isCrop())
                     + ", perspective: " + yesNo(editOptions.isPerspectiveCorrection()) + ", HDR: "
                     + yesNo(editOptions.isHdrMerge()));
        if (editOptions.isStraighten() || editOptions.isSkyReplacement() || editOptions.isSmoothSkin()) {
            console.note("Straighten: " + yesNo(editOptions.isStraighten()) + ", sky replacement: "
                         + yesNo(editOptions.isSkyReplacement()) + ", smooth skin: "
                         + yesNo(editOptions.isSmoothSkin()));
        }
    }

    private void printResults(ImagenJob job) {
        console.info("Processing complete.");
        console.note("Downloaded: " + job.getDownloadedFiles() + " files");
        if (!job.getFailedDownloads().isEmpty()) {
            console.warn(job.getFailedDownloads().size() + " files could not be downloaded: "
                         + String.join(", ", job.getFailedDownloads()));
        }
        job.getDurationForHumans().ifPresent(duration -> console.note("Duration: " + duration));
        console.note("View your processed images at: "
                     + Path.of(job.getOutputDirectory()).resolve(DownloadStep.EDITED_DIRECTORY));
    }

    // ----- flambient -----

    private int runFlambient(ProcessCommandOptions options) {
        Path input = options.requireInput();
        ClassificationRule rule = options.classificationRule();
        if (options.getSample() != null) {
            return showSample(input, rule, options.getSample());
        }

        console.info("Flambient processing of " + input);
        console.note("Strategy: " + rule.strategy().getLabel() + " (" + rule.exifField() + " = " + rule.ambientValue()
                     + " means ambient)");
        FlambientRunResult result = flambientWorkflowService.prepare(
                FlambientRunRequest.builder()
                                   .inputDirectory(input)
                                   .outputDirectory(options.getOutput())
                                   .rule(rule)
                                   .levelLow(options.getLevelLow())
                                   .levelHigh(options.getLevelHigh())
                                   .gamma(options.getGamma())
                                   .build());
        printFlambientResult(result);

        if (!result.hasBlendedFiles()) {
            console.error("No group was blended, nothing to edit");
            return FAILURE;
        }
        if (options.isLocal()) {
            console.info("Local mode, blended images are in " + result.flambientDirectory());
            return SUCCESS;
        }

        EditOptions editOptions = options.editOptions(editPresetCatalog.resolve(options.getPreset()));
        ImagenJob job = imagenJobService.createJob(
                CreateJobRequest.builder()
                                .inputDirectory(result.flambientDirectory())
                                .outputDirectory(result.outputDirectory())
                                .files(result.blendedFiles())
                                .projectName(options.getProjectName() != null
                                                     ? options.getProjectName()
                                                     : input.toAbsolutePath().normalize().getFileName().toString())
                                .profileKey(options.getProfile())
                                .photographyType(editOptions.getPhotographyType())
                                .editOptions(editOptions)
                                .sourceType(options.sourceType(JobSourceType.FLAMBIENT))
                                .parentJobId(options.getParent())
                                .build());
        return launch(job, options);
    }

    private int showSample(Path input, ClassificationRule rule, int size) {
        List<ExposureRecord> records = exifExtractionService.sample(input, rule, size);
        console.info("First " + records.size() + " images, field " + rule.exifField() + " ("
                     + rule.strategy().getHelpText() + ")");
        for (ExposureRecord record : records) {
            ExifValue value = record.field(rule.exifField()).orElse(null);
            console.note(String.format("%-32s  %-8s  %s", record.filename(), value == null ? "-" : value.raw(),
                                       value == null ? "" : value.label()));
        }
        return SUCCESS;
    }

    private void printFlambientResult(FlambientRunResult result) {
        GroupStatistics statistics = result.statistics();
        console.note("Groups: " + statistics.totalGroups() + " (" + statistics.groupsWithBoth() + " blendable, "
                     + statistics.groupsAmbientOnly() + " ambient only, " + statistics.groupsFlashOnly()
                     + " flash only)");
        console.note("Scripts: " + result.scripts().masterScript().getParent());
        CompositingReport compositing = result.compositing();
        console.note("Blended: " + compositing.succeeded().size() + "/" + compositing.outcomes().size());
        for (CompositingReport.GroupOutcome failure : compositing.failed()) {
            console.warn(String.format("Group %02d failed: %s", failure.groupNumber(), failure.error()));
        }
    }

    // ----- profiles -----

    private int listProfiles() {
        List<ImagenProfile> profiles = imagenApiClient.getProfiles();
        if (profiles.isEmpty()) {
            console.info("No editing profiles available.");
            return SUCCESS;
        }
        console.info(String.format("%-10s  %-32s  %-10s  %s", "Key", "Name", "Type", "Image type"));
        for (ImagenProfile profile : profiles) {
            console.info(String.format("%-10s  %-32s  %-10s  %s", profile.key(), abbreviate(profile.name(), 32),
                                       nullToDash(profile.profileType()), nullToDash(profile.imageType())));
        }
        return SUCCESS;
    }

    private static String shortId(ImagenJob job) {
        return job.getId().length() > 8 ? job.getId().substring(0, 8) : job.getId();
    }

    private static String abbreviate(String value, int width) {
        if (value == null) {
            return "-";
        }
        return value.length() <= width ? value : value.substring(0, width - 3) + "...";
    }

    private static String nullToDash(String value) {
        return value == null ? "-" : value;
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }
}
