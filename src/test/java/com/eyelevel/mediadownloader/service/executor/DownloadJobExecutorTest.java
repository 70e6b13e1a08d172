package com.eyelevel.mediadownloader.service.executor;

import com.eyelevel.mediadownloader.config.DownloadProperties;
import com.eyelevel.mediadownloader.exception.RemuxException;
import com.eyelevel.mediadownloader.exception.StorageExhaustedException;
import com.eyelevel.mediadownloader.exception.apiclient.NotFoundException;
import com.eyelevel.mediadownloader.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.model.JobOutcome;
import com.eyelevel.mediadownloader.model.OutcomeStatus;
import com.eyelevel.mediadownloader.model.RemuxRetryMode;
import com.eyelevel.mediadownloader.service.content.MediaContentClassifier;
import com.eyelevel.mediadownloader.service.fetch.FetchResponse;
import com.eyelevel.mediadownloader.service.fetch.RemoteFetcher;
import com.eyelevel.mediadownloader.service.index.ExistingOutputIndex;
import com.eyelevel.mediadownloader.service.remux.MediaRemuxer;
import com.eyelevel.mediadownloader.service.retry.DownloadRetryListener;
import com.eyelevel.mediadownloader.service.retry.DownloadRetryTemplateFactory;
import com.eyelevel.mediadownloader.service.retry.FailureClassifier;
import com.eyelevel.mediadownloader.service.scheduler.DownloadRunContext;
import com.eyelevel.mediadownloader.service.throttle.RateGovernor;
import com.eyelevel.mediadownloader.service.throttle.RequestCadenceGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownloadJobExecutorTest {

    private static final byte[] MEDIA = "not really a video, but enough bytes".getBytes(StandardCharsets.UTF_8);
    private static final MediaType MP4 = MediaType.parseMediaType("video/mp4");
    private static final MediaType MPEG_TS = MediaType.parseMediaType("video/mp2t");

    @TempDir
    Path outputDir;

    private DownloadProperties properties;
    private ScriptedFetcher fetcher;
    private ScriptedRemuxer remuxer;
    private List<Long> backoffs;
    private DownloadJobExecutor executor;
    private DownloadRunContext context;

    @BeforeEach
    void setUp() {
        properties = new DownloadProperties();
        properties.getRetry().setInitialDelayMs(100);
        properties.getRetry().setMultiplier(2.0);
        properties.getRetry().setMaxDelayMs(1000);
        fetcher = new ScriptedFetcher();
        remuxer = new ScriptedRemuxer();
        backoffs = new CopyOnWriteArrayList<>();

        executor = newExecutor(fetcher);
        context = new DownloadRunContext(ExistingOutputIndex.empty());
    }

    private DownloadJobExecutor newExecutor(RemoteFetcher remoteFetcher) {
        FailureClassifier failureClassifier = new FailureClassifier();
        return new DownloadJobExecutor(
                properties,
                remoteFetcher,
                RateGovernor.unbounded(),
                new RequestCadenceGuard(0, java.time.Duration.ZERO, millis -> { }),
                new MediaContentClassifier(),
                remuxer,
                failureClassifier,
                new DownloadRetryTemplateFactory(properties, failureClassifier, new DownloadRetryListener(),
                        backoffs::add));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Existing output is skipped without any request")
    void skipsExistingOutput() throws IOException {
        // given
        Files.writeString(outputDir.resolve("clip.ts"), "old");
        DownloadRunContext indexed = new DownloadRunContext(ExistingOutputIndex.build(outputDir));

        // when
        JobOutcome outcome = executor.execute(job("clip.mp4").skipIfExists(true).build(), indexed);

        // then
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.SKIPPED);
        assertThat(outcome.attempts()).isZero();
        assertThat(fetcher.calls).hasValue(0);
    }

    @Test
    @DisplayName("A direct download lands at the output path and leaves no temporary file")
    void downloadsDirectContent() throws IOException {
        fetcher.respond(() -> response(MP4, MEDIA));

        JobOutcome outcome = executor.execute(job("clip.mp4").build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.outputPath()).isEqualTo(outputDir.resolve("clip.mp4"));
        assertThat(Files.readAllBytes(outputDir.resolve("clip.mp4"))).isEqualTo(MEDIA);
        assertThat(filesIn(outputDir)).containsExactly("clip.mp4");
    }

    @Test
    @DisplayName("Transient failures use the whole budget, back off and clean up")
    void transientFailureExhaustsBudget() throws IOException {
        fetcher.failWith(() -> new ServiceUnavailableException("try later"));

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(2).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.reason()).contains("ServiceUnavailableException");
        assertThat(fetcher.calls).hasValue(3);
        assertThat(backoffs).containsExactly(100L, 200L);
        assertThat(filesIn(outputDir)).isEmpty();
    }

    @Test
    @DisplayName("A permanent failure ends the job after one attempt")
    void permanentFailureIsNotRetried() throws IOException {
        fetcher.failWith(() -> new NotFoundException("gone"));

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(3).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(fetcher.calls).hasValue(1);
        assertThat(backoffs).isEmpty();
        assertThat(filesIn(outputDir)).isEmpty();
    }

    @Test
    @DisplayName("An HTML page instead of media is unsupported content")
    void challengePageIsPermanent() throws IOException {
        fetcher.respond(() -> response(MediaType.TEXT_HTML, "<html>checking your browser</html>".getBytes()));

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(3).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.reason()).contains("UnsupportedContentException");
        assertThat(fetcher.calls).hasValue(1);
        assertThat(filesIn(outputDir)).isEmpty();
    }

    @Test
    @DisplayName("A body shorter than its declared length is retried")
    void shortBodyIsRetried() throws IOException {
        fetcher.respond(() -> new FetchResponse(MP4, MEDIA.length + 100L, new ByteArrayInputStream(MEDIA)));
        fetcher.respond(() -> response(MP4, MEDIA));

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(1).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(Files.readAllBytes(outputDir.resolve("clip.mp4"))).isEqualTo(MEDIA);
        assertThat(filesIn(outputDir)).containsExactly("clip.mp4");
    }

    @Test
    @DisplayName("A stream that breaks off mid-transfer is retried")
    void brokenStreamIsRetried() throws IOException {
        fetcher.respond(() -> new FetchResponse(MP4, -1, new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("Connection reset");
            }
        }));
        fetcher.respond(() -> response(MP4, MEDIA));

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(1).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(fetcher.calls).hasValue(2);
    }

    @Test
    @DisplayName("Transport streams are remuxed into an MP4 at the output path")
    void remuxesSegmentedContent() throws IOException {
        fetcher.respond(() -> response(MPEG_TS, MEDIA));

        JobOutcome outcome = executor.execute(job("clip.mp4").build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.outputPath()).isEqualTo(outputDir.resolve("clip.mp4"));
        assertThat(remuxer.inputs).hasSize(1);
        assertThat(remuxer.inputs.get(0).getFileName().toString()).endsWith(".part");
        assertThat(filesIn(outputDir)).containsExactly("clip.mp4");
    }

    @Test
    @DisplayName("With remuxing disabled a transport stream is kept as .ts")
    void keepsTransportStreamWhenRemuxDisabled() throws IOException {
        properties.getRemux().setEnabled(false);
        fetcher.respond(() -> response(MPEG_TS, MEDIA));

        JobOutcome outcome = executor.execute(job("clip.mp4").build(), context);

        assertThat(outcome.outputPath()).isEqualTo(outputDir.resolve("clip.ts"));
        assertThat(remuxer.inputs).isEmpty();
        assertThat(filesIn(outputDir)).containsExactly("clip.ts");
    }

    @Test
    @DisplayName("In remux-only mode a failed remux is retried without fetching again")
    void remuxOnlyRetryKeepsDownload() throws IOException {
        properties.getRemux().setRetryMode(RemuxRetryMode.REMUX_ONLY);
        fetcher.respond(() -> response(MPEG_TS, MEDIA));
        remuxer.failTimes(1);

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(2).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(fetcher.calls).hasValue(1);
        assertThat(remuxer.inputs).hasSize(2);
        assertThat(remuxer.inputs.get(1)).isEqualTo(remuxer.inputs.get(0));
        assertThat(filesIn(outputDir)).containsExactly("clip.mp4");
    }

    @Test
    @DisplayName("In re-fetch mode a failed remux discards the download and fetches again")
    void refetchRetryDownloadsAgain() throws IOException {
        properties.getRemux().setRetryMode(RemuxRetryMode.REFETCH);
        fetcher.respond(() -> response(MPEG_TS, MEDIA));
        fetcher.respond(() -> response(MPEG_TS, MEDIA));
        remuxer.failTimes(1);

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(2).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(fetcher.calls).hasValue(2);
        assertThat(remuxer.inputs).hasSize(2);
        assertThat(remuxer.inputs.get(1)).isNotEqualTo(remuxer.inputs.get(0));
        assertThat(filesIn(outputDir)).containsExactly("clip.mp4");
    }

    @Test
    @DisplayName("Remux failures that exhaust the budget fail the job and clean up")
    void remuxFailureExhaustsBudget() throws IOException {
        fetcher.respond(() -> response(MPEG_TS, MEDIA));
        remuxer.failTimes(10);

        JobOutcome outcome = executor.execute(job("clip.mp4").retryBudget(1).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.reason()).contains("RemuxException");
        assertThat(filesIn(outputDir)).isEmpty();
    }

    @Test
    @DisplayName("Exhausted storage is propagated instead of being reported as a job failure")
    void storageExhaustionPropagates() throws IOException {
        fetcher.respond(() -> response(MPEG_TS, MEDIA));
        remuxer.failWith(new StorageExhaustedException("Cannot write output",
                new IOException("No space left on device")));

        assertThatThrownBy(() -> executor.execute(job("clip.mp4").retryBudget(3).build(), context))
                .isInstanceOf(StorageExhaustedException.class);
        assertThat(fetcher.calls).hasValue(1);
        assertThat(filesIn(outputDir)).isEmpty();
    }

    @Test
    @DisplayName("A cancelled run yields a cancelled outcome without a request")
    void cancelledBeforeStart() throws IOException {
        context.cancel();

        JobOutcome outcome = executor.execute(job("clip.mp4").build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(fetcher.calls).hasValue(0);
        assertThat(filesIn(outputDir)).isEmpty();
    }

    @Test
    @DisplayName("Interruption during backoff cancels the job")
    void interruptedBackoffCancels() throws IOException {
        DownloadRetryTemplateFactory interruptingFactory = new DownloadRetryTemplateFactory(properties,
                new FailureClassifier(), new DownloadRetryListener(), millis -> {
            throw new InterruptedException("cancelled");
        });
        DownloadJobExecutor interrupting = new DownloadJobExecutor(properties, fetcher, RateGovernor.unbounded(),
                new RequestCadenceGuard(0, java.time.Duration.ZERO, millis -> { }), new MediaContentClassifier(),
                remuxer, new FailureClassifier(), interruptingFactory);
        fetcher.failWith(() -> new ServiceUnavailableException("try later"));

        JobOutcome outcome = interrupting.execute(job("clip.mp4").retryBudget(3).build(), context);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(filesIn(outputDir)).isEmpty();
    }

    @Test
    @DisplayName("An existing file is never replaced unless overwriting is allowed")
    void respectsOverwriteFlag() throws IOException {
        Files.writeString(outputDir.resolve("clip.mp4"), "keep me");
        fetcher.respond(() -> response(MP4, MEDIA));

        JobOutcome refused = executor.execute(job("clip.mp4").retryBudget(2).build(), context);

        assertThat(refused.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(refused.attempts()).isEqualTo(1);
        assertThat(Files.readString(outputDir.resolve("clip.mp4"))).isEqualTo("keep me");
        assertThat(filesIn(outputDir)).containsExactly("clip.mp4");

        fetcher.respond(() -> response(MP4, MEDIA));
        JobOutcome replaced = executor.execute(job("clip.mp4").overwrite(true).build(), context);

        assertThat(replaced.status()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(Files.readAllBytes(outputDir.resolve("clip.mp4"))).isEqualTo(MEDIA);
    }

    @Test
    @DisplayName("Jobs racing for one output path never replace each other's file")
    void concurrentJobsOnSamePathPublishOnce() throws Exception {
        int jobs = 6;
        for (int round = 0; round < 10; round++) {
            // given
            String fileName = "clip-" + round + ".mp4";
            CyclicBarrier aligned = new CyclicBarrier(jobs);
            AtomicInteger bodies = new AtomicInteger();
            DownloadJobExecutor racing = newExecutor(job -> {
                awaitQuietly(aligned);
                byte[] body = ("body-" + bodies.incrementAndGet()).getBytes(StandardCharsets.UTF_8);
                return response(MP4, body);
            });
            ExecutorService pool = Executors.newFixedThreadPool(jobs);

            // when
            List<Future<JobOutcome>> pending = new ArrayList<>();
            for (int i = 0; i < jobs; i++) {
                pending.add(pool.submit(() -> racing.execute(job(fileName).build(), context)));
            }
            List<JobOutcome> outcomes = new ArrayList<>();
            for (Future<JobOutcome> future : pending) {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            }
            pool.shutdown();

            // then
            assertThat(outcomes).filteredOn(outcome -> outcome.status() == OutcomeStatus.COMPLETED).hasSize(1);
            assertThat(outcomes).filteredOn(outcome -> outcome.status() == OutcomeStatus.FAILED)
                    .hasSize(jobs - 1)
                    .allSatisfy(outcome -> assertThat(outcome.attempts()).isEqualTo(1));
            assertThat(Files.readString(outputDir.resolve(fileName))).startsWith("body-");
        }
        assertThat(filesIn(outputDir)).hasSize(10).allSatisfy(name -> assertThat(name).doesNotEndWith(".part"));
    }

    private static void awaitQuietly(CyclicBarrier barrier) {
        try {
            barrier.await(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException("Jobs were not aligned", e);
        }
    }

    private DownloadJob.DownloadJobBuilder job(String fileName) {
        return DownloadJob.builder()
                .sourceUrl(URI.create("https://media.example/watch/" + fileName))
                .outputPath(outputDir.resolve(fileName))
                .skipIfExists(false)
                .retryBudget(0);
    }

    private static FetchResponse response(MediaType type, byte[] body) {
        return new FetchResponse(type, body.length, new ByteArrayInputStream(body));
    }

    private static List<String> filesIn(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }

    /**
     * Answers with queued responses in order; the last one repeats.
     */
    private static class ScriptedFetcher implements RemoteFetcher {
        private final Deque<Supplier<FetchResponse>> script = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();

        void respond(Supplier<FetchResponse> response) {
            script.add(response);
        }

        void failWith(Supplier<RuntimeException> failure) {
            script.add(() -> {
                throw failure.get();
            });
        }

        @Override
        public FetchResponse fetch(DownloadJob job) {
            calls.incrementAndGet();
            Supplier<FetchResponse> next = script.size() > 1 ? script.poll() : script.peek();
            if (next == null) {
                throw new IllegalStateException("No scripted response");
            }
            return next.get();
        }
    }

    private static class ScriptedRemuxer implements MediaRemuxer {
        private final List<Path> inputs = new ArrayList<>();
        private int failuresLeft;
        private RuntimeException failure;

        void failTimes(int times) {
            failuresLeft = times;
        }

        void failWith(RuntimeException error) {
            failure = error;
        }

        @Override
        public void remux(Path input, Path output, String contextInfo) {
            inputs.add(input);
            if (failure != null) {
                throw failure;
            }
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new RemuxException("ffmpeg exited with code 1");
            }
            try {
                Files.copy(input, output, java.nio.file.StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new RemuxException("copy failed", e);
            }
        }
    }
}
