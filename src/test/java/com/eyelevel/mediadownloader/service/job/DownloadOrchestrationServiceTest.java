package com.eyelevel.mediadownloader.service.job;

import com.eyelevel.mediadownloader.config.DownloadProperties;
import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.model.JobOutcome;
import com.eyelevel.mediadownloader.model.OutcomeStatus;
import com.eyelevel.mediadownloader.model.RunResult;
import com.eyelevel.mediadownloader.model.RunStatus;
import com.eyelevel.mediadownloader.service.executor.JobExecutor;
import com.eyelevel.mediadownloader.service.scheduler.DownloadRunContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DownloadOrchestrationServiceTest {

    @TempDir
    Path tempDir;

    private DownloadProperties properties;
    private final List<DownloadJob> executed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new DownloadProperties();
        properties.setOutputDirectory(tempDir.resolve("out").toString());
        properties.setConcurrency(2);
        properties.setQueueCapacity(4);
        properties.setShutdownGrace(Duration.ofSeconds(2));
        properties.getRetry().setBudget(5);
    }

    @Test
    @DisplayName("Opening a run creates the output directory and indexes its files")
    void openRunIndexesOutput() throws Exception {
        // given
        Path outputRoot = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(outputRoot.resolve("episode-01.mp4"), "media");

        // when
        DownloadRunContext context = service(recordingExecutor()).openRun();

        // then
        assertThat(context.getOutputIndex().contains("episode-01")).isTrue();
        assertThat(context.getOutputIndex().contains("episode-02")).isFalse();
    }

    @Test
    void openRunCreatesMissingDirectory() throws Exception {
        service(recordingExecutor()).openRun();

        assertThat(tempDir.resolve("out")).isDirectory();
    }

    @Test
    void jobBuilderAppliesConfiguredDefaults() {
        properties.setOverwrite(true);
        properties.setSkipExisting(false);
        DownloadOrchestrationService service = service(recordingExecutor());

        DownloadJob job = service.jobBuilder(URI.create("https://cdn.example/a.mp4"), service.resolveOutput("a.mp4"))
                .build();

        assertThat(job.overwrite()).isTrue();
        assertThat(job.skipIfExists()).isFalse();
        assertThat(job.retryBudget()).isEqualTo(5);
        assertThat(job.outputPath()).isEqualTo(tempDir.resolve("out").resolve("a.mp4").toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("Jobs submitted before a producer fails still run to an outcome")
    void producerFailureKeepsSubmittedJobs() throws Exception {
        // given
        DownloadOrchestrationService service = service(recordingExecutor());
        DownloadRunContext context = service.openRun();

        // when
        RunResult result = service.runWithProducer(sink -> {
            sink.submit(service.jobBuilder(URI.create("https://cdn.example/1.mp4"), service.resolveOutput("1.mp4")).build());
            sink.submit(service.jobBuilder(URI.create("https://cdn.example/2.mp4"), service.resolveOutput("2.mp4")).build());
            throw new IllegalStateException("listing page could not be parsed");
        }, context);

        // then
        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.getCompleted()).isEqualTo(2);
        assertThat(executed).hasSize(2);
    }

    @Test
    @DisplayName("A single download is named after the current time and carries the referer")
    void downloadSingleUsesTimestampName() throws Exception {
        DownloadOrchestrationService service = service(recordingExecutor());

        RunResult result = service.downloadSingle("  https://cdn.example/v/clip.mp4 ", "https://site.example/watch",
                service.openRun());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(executed).singleElement().satisfies(job -> {
            assertThat(job.sourceUrl()).isEqualTo(URI.create("https://cdn.example/v/clip.mp4"));
            assertThat(job.referer()).isEqualTo("https://site.example/watch");
            assertThat(job.outputPath().getParent()).isEqualTo(properties.outputRoot());
            assertThat(job.outputPath().getFileName().toString())
                    .matches("\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}\\.\\d{3}\\.mp4");
        });
    }

    @Test
    @DisplayName("Shutting down cancels active runs and returns their partial result")
    void cancelActiveRunsStopsRunningDownloads() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        JobExecutor blocking = (job, context) -> {
            started.countDown();
            try {
                while (!context.isCancelled()) {
                    Thread.sleep(10);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return JobOutcome.cancelled(job, 1);
        };
        DownloadOrchestrationService service = service(blocking);
        DownloadRunContext context = service.openRun();
        CompletableFuture<RunResult> pending = CompletableFuture.supplyAsync(() ->
                service.downloadSingle("https://cdn.example/long.mp4", null, context));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        service.cancelActiveRuns();

        // then
        RunResult result = pending.get(10, TimeUnit.SECONDS);
        assertThat(result.getStatus()).isEqualTo(RunStatus.CANCELLED);
        assertThat(result.getOutcomes()).extracting(JobOutcome::status).containsExactly(OutcomeStatus.CANCELLED);
        assertThat(result.exitCode()).isEqualTo(1);
    }

    private JobExecutor recordingExecutor() {
        return (job, context) -> {
            executed.add(job);
            return JobOutcome.completed(job, job.outputPath(), 1);
        };
    }

    private DownloadOrchestrationService service(JobExecutor executor) {
        return new DownloadOrchestrationService(properties, executor);
    }
}
