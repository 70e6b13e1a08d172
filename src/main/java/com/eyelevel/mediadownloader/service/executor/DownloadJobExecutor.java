package com.eyelevel.mediadownloader.service.executor;

import com.eyelevel.mediadownloader.config.DownloadProperties;
import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import com.eyelevel.mediadownloader.exception.IncompleteTransferException;
import com.eyelevel.mediadownloader.exception.PermanentDownloadException;
import com.eyelevel.mediadownloader.exception.RemuxException;
import com.eyelevel.mediadownloader.exception.StorageExhaustedException;
import com.eyelevel.mediadownloader.exception.TransientDownloadException;
import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.model.FailureClass;
import com.eyelevel.mediadownloader.model.JobOutcome;
import com.eyelevel.mediadownloader.model.MediaContainer;
import com.eyelevel.mediadownloader.model.RemuxRetryMode;
import com.eyelevel.mediadownloader.service.content.MediaContent;
import com.eyelevel.mediadownloader.service.content.MediaContentClassifier;
import com.eyelevel.mediadownloader.service.fetch.FetchResponse;
import com.eyelevel.mediadownloader.service.fetch.RemoteFetcher;
import com.eyelevel.mediadownloader.service.remux.MediaRemuxer;
import com.eyelevel.mediadownloader.service.retry.DownloadRetryListener;
import com.eyelevel.mediadownloader.service.retry.DownloadRetryTemplateFactory;
import com.eyelevel.mediadownloader.service.retry.FailureClassifier;
import com.eyelevel.mediadownloader.service.scheduler.DownloadRunContext;
import com.eyelevel.mediadownloader.service.throttle.RateGovernor;
import com.eyelevel.mediadownloader.service.throttle.RequestCadenceGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one download job: skip check, fetch with retries, optional remux and atomic publish.
 * <p>
 * Each attempt passes the request cadence guard, streams the body through the shared rate governor
 * into a temporary file next to the final output, and only then renames it into place. Failures are
 * classified after every attempt; transient ones are retried with backoff until the job's budget is
 * spent, permanent ones end the job at once. Whatever the exit path, no temporary file survives.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadJobExecutor implements JobExecutor {

    private static final int COPY_BUFFER_SIZE = 64 * 1024;

    private final DownloadProperties properties;
    private final RemoteFetcher remoteFetcher;
    private final RateGovernor rateGovernor;
    private final RequestCadenceGuard cadenceGuard;
    private final MediaContentClassifier contentClassifier;
    private final MediaRemuxer remuxer;
    private final FailureClassifier failureClassifier;
    private final DownloadRetryTemplateFactory retryTemplateFactory;

    @Override
    public JobOutcome execute(DownloadJob job, DownloadRunContext context) {
        String label = job.label();
        if (job.skipIfExists() && context.getOutputIndex().contains(job.logicalName())) {
            log.debug("[{}] Output already present; skipping without a request.", label);
            return JobOutcome.skipped(job);
        }

        AttemptWorkspace workspace = new AttemptWorkspace(job);
        RetryTemplate retryTemplate = retryTemplateFactory.create(job);
        AtomicInteger attempts = new AtomicInteger();
        try {
            Path published = retryTemplate.execute(retryContext -> {
                retryContext.setAttribute(DownloadRetryListener.JOB_LABEL, label);
                int attempt = attempts.incrementAndGet();
                return attempt(job, context, workspace, attempt);
            });
            return JobOutcome.completed(job, published, attempts.get());
        } catch (StorageExhaustedException e) {
            throw e;
        } catch (RuntimeException e) {
            if (context.isCancelled() || failureClassifier.classify(e) == FailureClass.CANCELLED) {
                log.debug("[{}] Stopped by cancellation after {} attempt(s).", label, attempts.get());
                return JobOutcome.cancelled(job, attempts.get());
            }
            return JobOutcome.failed(job, attempts.get(), describe(e));
        } finally {
            workspace.cleanup();
        }
    }

    private Path attempt(DownloadJob job, DownloadRunContext context, AttemptWorkspace workspace, int attempt) {
        context.throwIfCancelled();
        if (workspace.hasRawDownload()) {
            log.info("[{}] Attempt {}/{}: reusing the downloaded stream.", job.label(), attempt, job.maxAttempts());
        } else {
            cadenceGuard.beforeRequest();
            log.info("[{}] Attempt {}/{}: downloading {}", job.label(), attempt, job.maxAttempts(), job.sourceUrl());
            MediaContent content = download(job, workspace);
            workspace.rawDownloaded(content);
        }
        return finish(job, workspace);
    }

    private MediaContent download(DownloadJob job, AttemptWorkspace workspace) {
        Path target;
        try {
            target = workspace.newRawFile();
        } catch (IOException e) {
            throw storageFailure(job, e);
        }

        try (FetchResponse response = remoteFetcher.fetch(job)) {
            MediaContent content = contentClassifier.classify(response.getContentType(), job.sourceUrl());
            long received = transfer(job, rateGovernor.wrap(response.getBody()), target);
            if (response.hasKnownLength() && received != response.getContentLength()) {
                throw new IncompleteTransferException(String.format("Received %d of %d bytes from %s", received,
                        response.getContentLength(), job.sourceUrl()));
            }
            if (received == 0) {
                throw new IncompleteTransferException("Empty response body from " + job.sourceUrl());
            }
            log.debug("[{}] Downloaded {} bytes ({}).", job.label(), received, content);
            return content;
        } catch (IOException e) {
            throw new IncompleteTransferException("Failed to close response from " + job.sourceUrl(), e);
        }
    }

    /**
     * Copies the body into {@code target}. Read failures and write failures are told apart: the
     * former mean a broken transfer, the latter a problem with the output location.
     */
    private long transfer(DownloadJob job, InputStream body, Path target) {
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            while (true) {
                int count;
                try {
                    count = body.read(buffer);
                } catch (InterruptedIOException e) {
                    throw new DownloadCancelledException("Transfer interrupted", e);
                } catch (IOException e) {
                    throw new IncompleteTransferException(
                            String.format("Transfer broke off after %d bytes: %s", total, e.getMessage()), e);
                }
                if (count < 0) {
                    return total;
                }
                out.write(buffer, 0, count);
                total += count;
            }
        } catch (ClosedByInterruptException e) {
            throw new DownloadCancelledException("Transfer interrupted", e);
        } catch (IOException e) {
            throw storageFailure(job, e);
        }
    }

    private Path finish(DownloadJob job, AttemptWorkspace workspace) {
        if (workspace.getRawContent() != MediaContent.SEGMENTED) {
            return publish(job, workspace.getRawFile(), job.outputPath());
        }
        DownloadProperties.Remux remux = properties.getRemux();
        if (!remux.isEnabled()) {
            return publish(job, workspace.getRawFile(), job.outputPathFor(MediaContainer.MPEG_TS));
        }

        Path remuxed;
        try {
            remuxed = workspace.newRemuxFile();
        } catch (IOException e) {
            throw storageFailure(job, e);
        }
        try {
            remuxer.remux(workspace.getRawFile(), remuxed, job.label());
        } catch (RemuxException e) {
            if (remux.getRetryMode() == RemuxRetryMode.REFETCH) {
                workspace.discardRaw();
            }
            throw e;
        }
        return publish(job, remuxed, job.outputPathFor(MediaContainer.MP4));
    }

    /**
     * Moves a finished temporary file to its final path in one step, so the final path never holds
     * a partial file. Without permission to overwrite, the file is linked into place: linking fails
     * if the target exists, even when another job creates it at the same moment.
     */
    private Path publish(DownloadJob job, Path source, Path target) {
        if (!job.overwrite() && Files.exists(target)) {
            throw new PermanentDownloadException("Output already exists and overwrite is disabled: " + target);
        }
        try {
            if (job.overwrite()) {
                replace(job, source, target);
            } else {
                publishNew(job, source, target);
            }
        } catch (FileAlreadyExistsException e) {
            throw new PermanentDownloadException("Output already exists and overwrite is disabled: " + target, e);
        } catch (IOException e) {
            throw storageFailure(job, e);
        }
        log.debug("[{}] Published {}", job.label(), target);
        return target;
    }

    private void replace(DownloadJob job, Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[{}] Atomic move not supported; falling back to a plain move.", job.label());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void publishNew(DownloadJob job, Path source, Path target) throws IOException {
        try {
            Files.createLink(target, source);
        } catch (UnsupportedOperationException e) {
            log.debug("[{}] Hard links not supported; falling back to a plain move.", job.label());
            Files.move(source, target);
            return;
        }
        try {
            Files.delete(source);
        } catch (IOException e) {
            // The output is already in place; the workspace removes the leftover link.
            log.debug("[{}] Could not remove temporary link {}: {}", job.label(), source, e.getMessage());
        }
    }

    private RuntimeException storageFailure(DownloadJob job, IOException e) {
        if (e instanceof ClosedByInterruptException) {
            return new DownloadCancelledException("Write interrupted", e);
        }
        if (failureClassifier.isStorageExhaustion(e)) {
            return new StorageExhaustedException("Cannot write output for " + job.label() + ": " + e.getMessage(), e);
        }
        return new TransientDownloadException("Failed writing output for " + job.label() + ": " + e.getMessage(), e);
    }

    private String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
