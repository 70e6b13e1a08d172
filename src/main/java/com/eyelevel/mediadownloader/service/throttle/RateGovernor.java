package com.eyelevel.mediadownloader.service.throttle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Aggregate bandwidth limiter shared by every concurrent transfer.
 * <p>
 * Works as a token bucket measured in bytes: tokens accrue at the configured rate and up to one
 * second's worth may be banked while the line is idle. A caller asking for more bytes than are
 * banked reserves the shortfall against the future and sleeps until its reservation matures.
 * The reservation is made under a short lock; the sleep happens outside it, so waiting callers
 * never block one another beyond their share of the budget.
 */
@Slf4j
public class RateGovernor {

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);
    private static final long BURST_SECONDS = 1;

    private final long bytesPerSecond;
    private final LongSupplier ticker;
    private final Sleeper sleeper;
    private final Object lock = new Object();

    private double storedBytes;
    private long nextFreeNanos;

    /**
     * @param bytesPerSecond Aggregate rate; must be positive.
     * @param ticker         Monotonic nanosecond clock.
     * @param sleeper        Interruptible sleeper, in milliseconds.
     */
    public RateGovernor(long bytesPerSecond, LongSupplier ticker, Sleeper sleeper) {
        if (bytesPerSecond <= 0) {
            throw new IllegalArgumentException("bytesPerSecond must be positive: " + bytesPerSecond);
        }
        this.bytesPerSecond = bytesPerSecond;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.nextFreeNanos = ticker.getAsLong();
    }

    private RateGovernor() {
        this.bytesPerSecond = 0;
        this.ticker = null;
        this.sleeper = null;
    }

    /**
     * A governor that never blocks.
     */
    public static RateGovernor unbounded() {
        return new RateGovernor();
    }

    public boolean isUnbounded() {
        return bytesPerSecond == 0;
    }

    public long getBytesPerSecond() {
        return bytesPerSecond;
    }

    /**
     * Blocks until {@code bytes} may be transferred without exceeding the aggregate rate.
     *
     * @throws InterruptedException if the caller is interrupted while waiting.
     */
    public void acquire(long bytes) throws InterruptedException {
        if (isUnbounded() || bytes <= 0) {
            return;
        }
        long waitNanos = reserve(bytes);
        if (waitNanos > 0) {
            sleeper.sleep(TimeUnit.NANOSECONDS.toMillis(waitNanos + 999_999));
        }
    }

    /**
     * Wraps a transfer stream so that every read is metered against this governor.
     */
    public InputStream wrap(InputStream source) {
        return isUnbounded() ? source : new ThrottledInputStream(source, this);
    }

    private long reserve(long bytes) {
        synchronized (lock) {
            long now = ticker.getAsLong();
            if (now > nextFreeNanos) {
                double accrued = (now - nextFreeNanos) * bytesPerSecond / NANOS_PER_SECOND;
                storedBytes = Math.min((double) bytesPerSecond * BURST_SECONDS, storedBytes + accrued);
                nextFreeNanos = now;
            }
            double fromStore = Math.min(bytes, storedBytes);
            double shortfall = bytes - fromStore;
            storedBytes -= fromStore;
            nextFreeNanos += (long) (shortfall * NANOS_PER_SECOND / bytesPerSecond);
            return nextFreeNanos - now;
        }
    }
}
