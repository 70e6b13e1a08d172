package com.eyelevel.mediadownloader.service.job;

import com.eyelevel.mediadownloader.config.DownloadProperties;
import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import com.eyelevel.mediadownloader.exception.StorageExhaustedException;
import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.model.MediaContainer;
import com.eyelevel.mediadownloader.model.RunResult;
import com.eyelevel.mediadownloader.service.executor.JobExecutor;
import com.eyelevel.mediadownloader.service.index.ExistingOutputIndex;
import com.eyelevel.mediadownloader.service.scheduler.DownloadRunContext;
import com.eyelevel.mediadownloader.service.scheduler.DownloadScheduler;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point for hosts: opens download runs, builds jobs with the configured defaults and wires a
 * producer to a scheduler.
 * <p>
 * Runs still active when the application context shuts down (for example on Ctrl-C, through Spring
 * Boot's JVM shutdown hook) are cancelled so that every job unwinds and cleans up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadOrchestrationService {

    private static final DateTimeFormatter TIMESTAMP_NAME = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss.SSS");

    private final DownloadProperties properties;
    private final JobExecutor jobExecutor;
    private final Set<DownloadRunContext> activeRuns = ConcurrentHashMap.newKeySet();

    /**
     * Starts a job with the configured skip, overwrite and retry defaults; callers may override
     * any of them before building.
     */
    public DownloadJob.DownloadJobBuilder jobBuilder(URI source, Path outputPath) {
        return DownloadJob.builder()
                .sourceUrl(source)
                .outputPath(outputPath)
                .skipIfExists(properties.isSkipExisting())
                .overwrite(properties.isOverwrite())
                .retryBudget(properties.getRetry().getBudget());
    }

    /**
     * Resolves a file name inside the configured output directory.
     */
    public Path resolveOutput(String fileName) {
        return properties.outputRoot().resolve(fileName);
    }

    /**
     * Prepares a run: makes sure the output directory exists and indexes what it already holds.
     *
     * @throws StorageExhaustedException if the output directory cannot be created.
     * @throws IOException               if the output directory cannot be listed.
     */
    public DownloadRunContext openRun() throws IOException {
        Path outputRoot = properties.outputRoot();
        try {
            Files.createDirectories(outputRoot);
        } catch (IOException e) {
            throw new StorageExhaustedException("Output directory cannot be created: " + outputRoot, e);
        }
        return new DownloadRunContext(ExistingOutputIndex.build(outputRoot));
    }

    public DownloadScheduler newScheduler() {
        return new DownloadScheduler(jobExecutor, properties.getConcurrency(), properties.getQueueCapacity(),
                properties.getShutdownGrace());
    }

    /**
     * Runs a scheduler in the background while the calling thread drives {@code producer}. The queue
     * is closed as soon as the producer returns or fails; a failing producer does not discard the
     * jobs it already submitted.
     *
     * @return the result once every submitted job has an outcome.
     */
    public RunResult runWithProducer(JobProducer producer, DownloadRunContext context) {
        DownloadScheduler scheduler = newScheduler();
        ExecutorService schedulerThread = Executors.newSingleThreadExecutor(
                new CustomizableThreadFactory("download-scheduler-"));
        activeRuns.add(context);
        try {
            Future<RunResult> pending = schedulerThread.submit(() -> scheduler.run(context));
            try {
                producer.produce(scheduler);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
            } catch (DownloadCancelledException e) {
                log.info("Job producer stopped: the run was cancelled.");
            } catch (Exception e) {
                log.error("Job producer failed; finishing the jobs already submitted.", e);
            } finally {
                scheduler.close();
            }
            return awaitResult(pending, context);
        } finally {
            activeRuns.remove(context);
            schedulerThread.shutdownNow();
        }
    }

    /**
     * Downloads a single locator into the output directory under a timestamp name.
     */
    public RunResult downloadSingle(String url, String referer, DownloadRunContext context) {
        String fileName = LocalDateTime.now().format(TIMESTAMP_NAME) + MediaContainer.MP4.suffix();
        DownloadJob job = jobBuilder(URI.create(url.strip()), resolveOutput(fileName))
                .referer(referer)
                .build();
        log.info("Downloading {} to {}", job.sourceUrl(), job.outputPath());
        return runWithProducer(sink -> sink.submit(job), context);
    }

    @PreDestroy
    public void cancelActiveRuns() {
        if (!activeRuns.isEmpty()) {
            log.warn("Shutting down; cancelling {} active download run(s).", activeRuns.size());
            activeRuns.forEach(DownloadRunContext::cancel);
        }
    }

    private RunResult awaitResult(Future<RunResult> pending, DownloadRunContext context) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return pending.get();
                } catch (InterruptedException e) {
                    // Cancelled runs return promptly, so keep waiting for the partial result.
                    interrupted = true;
                    context.cancel();
                }
            }
        } catch (ExecutionException e) {
            throw new IllegalStateException("Download scheduler failed", e.getCause());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
