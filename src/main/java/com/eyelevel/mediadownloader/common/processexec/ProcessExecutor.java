package com.eyelevel.mediadownloader.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
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
 * Runs external tools (ffmpeg) and collects their exit status and output.
 */
@Component
@Slf4j
public class ProcessExecutor {

    // Output beyond this many characters per stream is read but not kept.
    private static final int CAPTURE_LIMIT_CHARS = 16 * 1024;
    private static final long DRAIN_TIMEOUT_SECONDS = 5;

    /**
     * Starts {@code command} and waits for it to exit.
     * <p>
     * Both output streams are drained on their own threads while the caller waits. The process is
     * destroyed if it outlives the timeout or if the calling thread is interrupted, so a cancelled
     * download never leaves a tool running behind it.
     *
     * @param command        The command and its arguments.
     * @param contextInfo    Log prefix, usually the job label.
     * @param timeoutMinutes How long the process may run.
     * @param processName    Tool name used in log lines and thread names.
     * @return exit code plus the captured, trimmed stdout and stderr.
     * @throws IOException          if the process cannot be started or times out.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName)
            throws IOException, InterruptedException {

        log.debug("[{}] Starting {}: {}", contextInfo, processName, command);
        Process process = new ProcessBuilder(command).start();
        BoundedCapture stdout = new BoundedCapture();
        BoundedCapture stderr = new BoundedCapture();

        ExecutorService drainers = Executors.newFixedThreadPool(2, new CustomizableThreadFactory(processName + "-io-"));
        try {
            drainers.submit(() -> drain(process.getInputStream(), stdout, line -> { }));
            drainers.submit(() -> drain(process.getErrorStream(), stderr,
                    line -> log.debug("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeoutMinutes, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                throw new IOException(processName + " did not finish within " + timeoutMinutes + " minute(s).");
            }
        } catch (InterruptedException e) {
            log.warn("[{}] Interrupted while waiting for {}; destroying the process.", contextInfo, processName);
            process.destroyForcibly();
            throw e;
        } finally {
            drainers.shutdown();
        }

        if (!drainers.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            drainers.shutdownNow();
        }
        log.debug("[{}] {} exited with code {}.", contextInfo, processName, process.exitValue());
        return new ProcessResult(process.exitValue(), stdout.text(), stderr.text());
    }

    private static void drain(InputStream stream, BoundedCapture capture, Consumer<String> lineLogger) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineLogger.accept(line);
                capture.append(line);
            }
        } catch (IOException e) {
            log.warn("Error reading process output: {}", e.getMessage());
        }
    }

    private static final class BoundedCapture {
        private final StringBuilder text = new StringBuilder();

        synchronized void append(String line) {
            if (text.length() < CAPTURE_LIMIT_CHARS) {
                text.append(line).append('\n');
            }
        }

        synchronized String text() {
            return text.toString().trim();
        }
    }

    /**
     * Outcome of one external process run.
     *
     * @param exitCode Process exit code; 0 means success.
     * @param stdout   Captured standard output, truncated.
     * @param stderr   Captured standard error, truncated.
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
