package com.eyelevel.mediadownloader.service.scheduler;

import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.model.JobOutcome;
import com.eyelevel.mediadownloader.model.RunResult;

import java.util.ArrayList;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collects job outcomes from all workers of a run. Safe for concurrent use.
 */
class RunResultAccumulator {

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger abandoned = new AtomicInteger();
    private final AtomicReference<Throwable> fatalError = new AtomicReference<>();
    private final Queue<JobOutcome> outcomes = new ConcurrentLinkedQueue<>();

    void record(JobOutcome outcome) {
        outcomes.add(outcome);
        switch (outcome.status()) {
            case COMPLETED -> completed.incrementAndGet();
            case SKIPPED -> skipped.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            case CANCELLED -> abandoned.incrementAndGet();
        }
    }

    /**
     * Records the job that hit a fatal error. Only the first fatal error of a run is kept.
     */
    void recordFatal(DownloadJob job, Throwable error) {
        fatalError.compareAndSet(null, error);
        record(JobOutcome.failed(job, 0, error.getMessage()));
    }

    void recordAbandoned(DownloadJob job) {
        record(JobOutcome.cancelled(job, 0));
    }

    boolean hasFatalError() {
        return fatalError.get() != null;
    }

    RunResult toResult(boolean cancelled) {
        Throwable fatal = fatalError.get();
        return RunResult.builder()
                .completed(completed.get())
                .skipped(skipped.get())
                .failed(failed.get())
                .abandoned(abandoned.get())
                .cancelled(cancelled && fatal == null)
                .fatalError(fatal)
                .outcomes(new ArrayList<>(outcomes))
                .build();
    }
}
