package com.eyelevel.mediadownloader.service.fetch;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.Exceptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Blocking view of a reactive response body. Each read pulls from the buffered stream of
 * {@link DataBuffer}s and waits when none has arrived yet; closing cancels the exchange.
 * <p>
 * A thread interrupted while waiting gets an {@link InterruptedIOException}; any other failure of
 * the underlying exchange surfaces as an {@link IOException}.
 */
class DataBufferInputStream extends InputStream {

    private final Stream<DataBuffer> buffers;
    private final Iterator<DataBuffer> iterator;
    private DataBuffer current;
    private boolean closed;

    DataBufferInputStream(Stream<DataBuffer> buffers) {
        this.buffers = buffers;
        this.iterator = buffers.iterator();
    }

    @Override
    public int read() throws IOException {
        DataBuffer buffer = nextReadable();
        return buffer == null ? -1 : buffer.read() & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        DataBuffer buffer = nextReadable();
        if (buffer == null) {
            return -1;
        }
        int count = Math.min(len, buffer.readableByteCount());
        buffer.read(b, off, count);
        return count;
    }

    @Override
    public int available() {
        return current == null ? 0 : current.readableByteCount();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        releaseCurrent();
        buffers.close();
    }

    private DataBuffer nextReadable() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        while (current == null || current.readableByteCount() == 0) {
            releaseCurrent();
            if (!hasNext()) {
                return null;
            }
            current = iterator.next();
        }
        return current;
    }

    private boolean hasNext() throws IOException {
        try {
            return iterator.hasNext();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                InterruptedIOException interrupted = new InterruptedIOException("Interrupted while reading response body");
                interrupted.initCause(cause);
                throw interrupted;
            }
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException("Response body stream failed: " + cause.getMessage(), cause);
        }
    }

    private void releaseCurrent() {
        if (current != null) {
            DataBufferUtils.release(current);
            current = null;
        }
    }
}
