package com.eyelevel.flambientprocessor.service.job;

import com.eyelevel.flambientprocessor.model.ImagenJob;
import com.eyelevel.flambientprocessor.model.ImagenJobStatus;

/**
 * One stage of the remote editing pipeline.
 *
 * <p>The state machine moves the job into {@link #status()} before calling {@link #execute}; the
 * step moves it on to the next state when it finishes. Any exception fails the job at this step.
 */
public interface JobStep {

    ImagenJobStatus status();

    void execute(ImagenJob job, JobExecutionContext context);
}
