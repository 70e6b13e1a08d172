package com.eyelevel.mediadownloader.service.scheduler;

import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import com.eyelevel.mediadownloader.exception.StorageExhaustedException;
import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.model.JobOutcome;
import com.eyelevel.mediadownloader.model.RunResult;
import com.eyelevel.mediadownloader.model.SchedulerState;
import com.eyelevel.mediadownloader.service.executor.JobExecutor;
import com.eyelevel.mediadownloader.service.job.JobSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded-concurrency dispatcher between a job producer and the {@link JobExecutor}.
 * <p>
 * Producers {@link #submit(DownloadJob)} into a bounded FIFO queue and block while it is full.
 * {@link #run(DownloadRunContext)} starts a fixed number of workers that take jobs in submission
 * order and returns once the scheduler is closed, the queue is empty and every worker has
 * finished, or promptly after the run is cancelled. Every submitted job yields exactly one
 * outcome; jobs still queued when a run stops early are reported as abandoned.
 * <p>
 * Lifecycle: {@code OPEN -> DRAINING -> DONE}. A scheduler runs once.
 */
@Slf4j
public class DownloadScheduler implements JobSink {

    private static final long OFFER_SLICE_MS = 50;
    private static final long POLL_SLICE_MS = 100;
    private static final long AWAIT_SLICE_MS = 200;

    private final JobExecutor jobExecutor;
    private final int concurrency;
    private final Duration shutdownGrace;
    private final BlockingQueue<DownloadJob> queue;

    // Submitters hold the read lock across their offer so that closing waits for them.
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile SchedulerState state = SchedulerState.OPEN;
    private volatile DownloadRunContext activeContext;

    public DownloadScheduler(JobExecutor jobExecutor, int concurrency, int queueCapacity, Duration shutdownGrace) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1: " + queueCapacity);
        }
        this.jobExecutor = jobExecutor;
        this.concurrency = concurrency;
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace must not be null");
        this.queue = new ArrayBlockingQueue<>(queueCapacity, true);
    }

    @Override
    public void submit(DownloadJob job) throws InterruptedException {
        Objects.requireNonNull(job, "job must not be null");
        while (true) {
            stateLock.readLock().lockInterruptibly();
            try {
                if (state != SchedulerState.OPEN) {
                    throw new IllegalStateException("Scheduler no longer accepts jobs (state: " + state + ")");
                }
                DownloadRunContext context = activeContext;
                if (context != null) {
                    context.throwIfCancelled();
                }
                if (queue.offer(job, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
                    log.debug("[{}] Queued ({} waiting).", job.label(), queue.size());
                    return;
                }
            } finally {
                stateLock.readLock().unlock();
            }
        }
    }

    /**
     * Signals that no further jobs will be submitted. Queued jobs still run. Idempotent.
     */
    public void close() {
        stateLock.writeLock().lock();
        try {
            if (state == SchedulerState.OPEN) {
                state = SchedulerState.DRAINING;
                log.debug("Scheduler closed with {} job(s) queued.", queue.size());
            }
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    public SchedulerState getState() {
        return state;
    }

    /**
     * Runs the workers until the queue is closed and drained or the run is cancelled.
     *
     * @param context The run's context; cancelling it stops the run.
     * @return the aggregate result of every job submitted to this scheduler.
     */
    public RunResult run(DownloadRunContext context) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler has already been run");
        }
        activeContext = context;
        log.info("Starting download run with {} worker(s).", concurrency);

        RunResultAccumulator accumulator = new RunResultAccumulator();
        ExecutorService workers = Executors.newFixedThreadPool(concurrency,
                new CustomizableThreadFactory("download-worker-"));
        for (int i = 0; i < concurrency; i++) {
            workers.execute(() -> workerLoop(context, accumulator));
        }
        workers.shutdown();
        context.onCancel(workers::shutdownNow);
        awaitWorkers(workers, context);

        stateLock.writeLock().lock();
        try {
            state = SchedulerState.DONE;
        } finally {
            stateLock.writeLock().unlock();
        }
        List<DownloadJob> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        if (!leftover.isEmpty()) {
            log.info("Abandoning {} queued job(s).", leftover.size());
            leftover.forEach(accumulator::recordAbandoned);
        }

        RunResult result = accumulator.toResult(context.isCancelled());
        if (result.getFatalError() != null) {
            log.error("Run aborted: {}", result.getFatalError().getMessage());
        }
        log.info("Run finished. {}", result.summary());
        return result;
    }

    private void workerLoop(DownloadRunContext context, RunResultAccumulator accumulator) {
        while (!context.isCancelled()) {
            DownloadJob job;
            try {
                job = queue.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (job == null) {
                // Once closed nothing more can be offered, so an empty queue stays empty.
                if (state != SchedulerState.OPEN && queue.isEmpty()) {
                    return;
                }
                continue;
            }
            executeJob(job, context, accumulator);
        }
    }

    private void executeJob(DownloadJob job, DownloadRunContext context, RunResultAccumulator accumulator) {
        try {
            JobOutcome outcome = jobExecutor.execute(job, context);
            accumulator.record(outcome);
            logOutcome(outcome);
        } catch (StorageExhaustedException e) {
            log.error("[{}] Output storage is exhausted; aborting the run.", job.label(), e);
            accumulator.recordFatal(job, e);
            context.cancel();
        } catch (DownloadCancelledException e) {
            accumulator.record(JobOutcome.cancelled(job, 0));
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while executing job.", job.label(), e);
            accumulator.record(JobOutcome.failed(job, 0, e.toString()));
        }
    }

    private void awaitWorkers(ExecutorService workers, DownloadRunContext context) {
        try {
            while (!workers.awaitTermination(AWAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
                if (context.isCancelled()) {
                    if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("Workers did not stop within {} of cancellation.", shutdownGrace);
                    }
                    return;
                }
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for workers; cancelling the run.");
            Thread.currentThread().interrupt();
            context.cancel();
        }
    }

    private void logOutcome(JobOutcome outcome) {
        String label = outcome.job().label();
        switch (outcome.status()) {
            case COMPLETED -> log.info("[{}] Completed: {}", label, outcome.outputPath());
            case SKIPPED -> log.info("[{}] Skipped: {}", label, outcome.reason());
            case FAILED -> log.warn("[{}] Failed after {} attempt(s): {}", label, outcome.attempts(),
                    outcome.reason());
            case CANCELLED -> log.info("[{}] Cancelled.", label);
        }
    }
}
