package com.eyelevel.mediadownloader.service.throttle;

import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared request counter that forces a pause after a fixed number of remote requests.
 * <p>
 * Remote anti-abuse systems react to request cadence, not byte volume, so this works
 * independently of {@link RateGovernor}. The caller that finds the threshold reached sleeps for
 * the pause and then resets the counter. Callers arriving while that pause is in progress wait for
 * it to finish; callers already past this point are unaffected.
 */
@Slf4j
public class RequestCadenceGuard {

    private final int threshold;
    private final Duration pause;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition pauseFinished = lock.newCondition();
    private int requestsSincePause;
    private boolean pausing;

    /**
     * @param threshold Requests allowed between pauses; 0 disables the guard.
     * @param pause     How long to pause once the threshold is reached.
     * @param sleeper   Interruptible sleeper used for the pause.
     */
    public RequestCadenceGuard(int threshold, Duration pause, Sleeper sleeper) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must not be negative: " + threshold);
        }
        this.threshold = threshold;
        this.pause = pause;
        this.sleeper = sleeper;
    }

    /**
     * Accounts for one remote request, pausing first if the threshold has been reached.
     *
     * @throws DownloadCancelledException if the caller is interrupted while waiting or pausing.
     */
    public void beforeRequest() {
        if (threshold == 0) {
            return;
        }
        boolean mustPause;
        try {
            lock.lockInterruptibly();
            try {
                while (pausing) {
                    pauseFinished.await();
                }
                mustPause = requestsSincePause >= threshold;
                if (mustPause) {
                    pausing = true;
                } else {
                    requestsSincePause++;
                }
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Cancelled while waiting for a request cadence pause", e);
        }

        if (mustPause) {
            pauseThenReset();
        }
    }

    private void pauseThenReset() {
        boolean completed = false;
        try {
            log.info("Reached {} requests; pausing for {} to respect the remote request cadence.",
                    threshold, pause);
            sleeper.sleep(pause.toMillis());
            completed = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Cancelled during request cadence pause", e);
        } finally {
            lock.lock();
            try {
                if (completed) {
                    // The pausing caller's own request is the first of the new window.
                    requestsSincePause = 1;
                }
                pausing = false;
                pauseFinished.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    public int getThreshold() {
        return threshold;
    }

    public Duration getPause() {
        return pause;
    }
}
