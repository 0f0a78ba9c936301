package com.eyelevel.flambientprocessor.service.imagen;

import com.eyelevel.flambientprocessor.dto.imagen.RemoteStatus;
import com.eyelevel.flambientprocessor.exception.PollingTimeoutException;
import com.eyelevel.flambientprocessor.exception.RemoteEditException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Polls a one-shot remote status query at a fixed interval until it reports completion.
 */
@Slf4j
@Component
public class RemoteStatusPoller {

    /**
     * Waits between two polls.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;

    @Autowired
    public RemoteStatusPoller() {
        this(duration -> Thread.sleep(duration.toMillis()));
    }

    public RemoteStatusPoller(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Queries {@code query} up to {@code maxAttempts} times, sleeping {@code interval} between
     * attempts.
     *
     * @param name        Label used in log lines and error messages, e.g. {@code edit} or {@code export}.
     * @param query       The one-shot status query.
     * @param interval    Fixed wait between attempts.
     * @param maxAttempts Upper bound on queries.
     * @param onProgress  Called with the remote progress whenever it strictly increases.
     * @return the completed status.
     * @throws RemoteEditException     if the remote side reports failure.
     * @throws PollingTimeoutException if the attempts run out first.
     */
    public RemoteStatus poll(String name, Supplier<RemoteStatus> query, Duration interval, int maxAttempts,
                             IntConsumer onProgress) {
        int lastProgress = -1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            RemoteStatus status = query.get();
            log.debug("[{}] Poll {}/{}: {} at {}%", name, attempt, maxAttempts, status.status(), status.progress());

            if (status.isFailed()) {
                String detail = status.message() == null ? status.status() : status.message();
                throw new RemoteEditException("Remote " + name + " failed: " + detail);
            }
            if (status.progress() > lastProgress) {
                lastProgress = status.progress();
                onProgress.accept(lastProgress);
            }
            if (status.isComplete()) {
                log.info("[{}] Completed after {} poll(s)", name, attempt);
                return status;
            }
            if (attempt < maxAttempts) {
                pause(name, interval);
            }
        }
        throw new PollingTimeoutException("Remote " + name + " did not complete after " + maxAttempts + " attempts");
    }

    private void pause(String name, Duration interval) {
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteEditException("Polling of remote " + name + " was interrupted", e);
        }
    }
}
