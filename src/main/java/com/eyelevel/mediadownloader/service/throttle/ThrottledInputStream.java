package com.eyelevel.mediadownloader.service.throttle;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;

/**
 * Input stream whose reads are paced by a shared {@link RateGovernor}.
 */
class ThrottledInputStream extends FilterInputStream {

    private final RateGovernor governor;

    ThrottledInputStream(InputStream in, RateGovernor governor) {
        super(in);
        this.governor = governor;
    }

    @Override
    public int read() throws IOException {
        int value = super.read();
        if (value >= 0) {
            meter(1);
        }
        return value;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int count = super.read(b, off, len);
        if (count > 0) {
            meter(count);
        }
        return count;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = super.skip(n);
        if (skipped > 0) {
            meter(skipped);
        }
        return skipped;
    }

    private void meter(long bytes) throws InterruptedIOException {
        try {
            governor.acquire(bytes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while rate limited");
            interrupted.initCause(e);
            throw interrupted;
        }
    }
}
