package com.eyelevel.mediadownloader.service.retry;

import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import com.eyelevel.mediadownloader.exception.PermanentDownloadException;
import com.eyelevel.mediadownloader.exception.StorageExhaustedException;
import com.eyelevel.mediadownloader.exception.TransientDownloadException;
import com.eyelevel.mediadownloader.exception.apiclient.ApiException;
import com.eyelevel.mediadownloader.model.FailureClass;
import org.springframework.http.HttpStatus;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.AccessDeniedException;
import java.util.List;

/**
 * Maps failures raised during a download attempt onto the error taxonomy that drives retries.
 */
@Component
public class FailureClassifier {

    private static final List<String> STORAGE_EXHAUSTION_MESSAGES = List.of(
            "No space left on device", "Disk quota exceeded", "Read-only file system", "There is not enough space");

    public FailureClass classify(Throwable error) {
        if (error == null) {
            return FailureClass.NONE;
        }
        Throwable unwrapped = Exceptions.unwrap(error);
        if (isCancellation(unwrapped)) {
            return FailureClass.CANCELLED;
        }
        if (unwrapped instanceof StorageExhaustedException) {
            return FailureClass.FATAL;
        }
        if (unwrapped instanceof PermanentDownloadException) {
            return FailureClass.PERMANENT;
        }
        if (unwrapped instanceof TransientDownloadException) {
            return FailureClass.TRANSIENT;
        }
        if (unwrapped instanceof ApiException apiException) {
            return classifyStatus(apiException.getStatusCode());
        }
        if (unwrapped instanceof IOException) {
            return FailureClass.TRANSIENT;
        }
        return FailureClass.PERMANENT;
    }

    /**
     * Rate-limit signals, request timeouts and server errors are worth repeating; every other
     * status is a property of the request itself.
     */
    FailureClass classifyStatus(int statusCode) {
        if (statusCode == HttpStatus.REQUEST_TIMEOUT.value() || statusCode == HttpStatus.TOO_MANY_REQUESTS.value()
                || statusCode >= 500) {
            return FailureClass.TRANSIENT;
        }
        return FailureClass.PERMANENT;
    }

    /**
     * Whether a local write failure means the output location can no longer take data, as opposed
     * to a one-off I/O problem.
     */
    public boolean isStorageExhaustion(IOException error) {
        if (error instanceof AccessDeniedException) {
            return true;
        }
        String message = error.getMessage();
        return message != null && STORAGE_EXHAUSTION_MESSAGES.stream().anyMatch(message::contains);
    }

    private boolean isCancellation(Throwable error) {
        return error instanceof DownloadCancelledException
                || error instanceof BackOffInterruptedException
                || error instanceof InterruptedException
                || error instanceof InterruptedIOException
                || error instanceof ClosedByInterruptException;
    }
}
