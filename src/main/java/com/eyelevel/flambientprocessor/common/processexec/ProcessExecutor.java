package com.eyelevel.flambientprocessor.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the external command-line tools (the EXIF reader and the compositing engine) with a timeout
 * and bounded output capture.
 */
@Component
@Slf4j
public class ProcessExecutor {

    /**
     * Default capture limit for stdout/stderr. Enough for error messages and engine chatter.
     */
    public static final int DEFAULT_CAPTURE_BYTES = 16 * 1024;

    /**
     * Capture limit for commands whose stdout is the payload (CSV metadata of a whole shoot).
     */
    public static final int UNBOUNDED_CAPTURE_BYTES = Integer.MAX_VALUE;

    private static final long STREAM_DRAIN_SECONDS = 10;

    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName)
    throws IOException, InterruptedException {
        return execute(command, contextInfo, timeoutMinutes, processName, DEFAULT_CAPTURE_BYTES);
    }

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     *
     * @param command         The command and its arguments to execute.
     * @param contextInfo     A string for logging context (e.g., the job or group id).
     * @param timeoutMinutes  The maximum time to wait for the process to complete.
     * @param processName     A descriptive name for the process (e.g., "exiftool").
     * @param maxStdoutBytes  How much stdout to keep in memory.
     * @return A ProcessResult containing the exit code and the captured stdout and stderr.
     * @throws IOException if the process cannot start or times out.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName,
                                 int maxStdoutBytes) throws IOException, InterruptedException {
        log.debug("[{}] Starting {}: {}", contextInfo, processName, String.join(" ", command));

        Process process = new ProcessBuilder(command).start();
        StringBuilder stdoutCapture = new StringBuilder();
        StringBuilder stderrCapture = new StringBuilder();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, maxStdoutBytes, null));
            executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                                               DEFAULT_CAPTURE_BYTES,
                                               line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName,
                                                                line)));

            if (!process.waitFor(timeoutMinutes, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                throw new IOException(processName + " process timed out after " + timeoutMinutes + " minutes.");
            }
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[{}] {} output streams did not drain in time", contextInfo, processName);
                executor.shutdownNow();
            }
        }

        int exitCode = process.exitValue();
        log.debug("[{}] {} exited with code {}", contextInfo, processName, exitCode);
        return new ProcessResult(exitCode, stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    /**
     * Drains one process stream, capturing up to a limit and optionally logging each line, so the
     * child never blocks on a full pipe.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final int maxBytes;
        private final Consumer<String> lineLogger;
        private long bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, int maxBytes,
                       Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.maxBytes = maxBytes;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < maxBytes) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * The result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 means success.
     * @param stdout   The captured standard output.
     * @param stderr   The captured standard error output (truncated to a safe limit).
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
