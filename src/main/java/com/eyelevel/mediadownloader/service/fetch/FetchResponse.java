package com.eyelevel.mediadownloader.service.fetch;

import lombok.Getter;
import org.springframework.http.MediaType;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An open response: its declared metadata plus the body, which is read exactly once.
 */
@Getter
public class FetchResponse implements Closeable {

    public static final long UNKNOWN_LENGTH = -1;

    private final MediaType contentType;
    private final long contentLength;
    private final InputStream body;

    /**
     * @param contentType   Declared content type, or {@code null} if the origin sent none.
     * @param contentLength Declared length in bytes, or {@link #UNKNOWN_LENGTH}.
     * @param body          The response body.
     */
    public FetchResponse(MediaType contentType, long contentLength, InputStream body) {
        this.contentType = contentType;
        this.contentLength = contentLength;
        this.body = body;
    }

    public boolean hasKnownLength() {
        return contentLength >= 0;
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
