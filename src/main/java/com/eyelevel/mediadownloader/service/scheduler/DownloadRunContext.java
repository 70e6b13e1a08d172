package com.eyelevel.mediadownloader.service.scheduler;

import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import com.eyelevel.mediadownloader.service.index.ExistingOutputIndex;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * State scoped to one download run: the output index taken at its start and the cancellation
 * signal observed by every suspension point of every job.
 * <p>
 * Cancelling is one-way. Listeners registered through {@link #onCancel(Runnable)} run exactly
 * once, on the cancelling thread, or immediately when registered after the fact.
 */
@Slf4j
public class DownloadRunContext {

    @Getter
    private final ExistingOutputIndex outputIndex;
    private final List<Runnable> cancelListeners = new ArrayList<>();
    private volatile boolean cancelled;

    public DownloadRunContext(ExistingOutputIndex outputIndex) {
        this.outputIndex = outputIndex;
    }

    public void cancel() {
        List<Runnable> listeners;
        synchronized (cancelListeners) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            listeners = new ArrayList<>(cancelListeners);
            cancelListeners.clear();
        }
        log.info("Download run cancelled.");
        listeners.forEach(this::notifyListener);
    }

    public void onCancel(Runnable listener) {
        synchronized (cancelListeners) {
            if (!cancelled) {
                cancelListeners.add(listener);
                return;
            }
        }
        notifyListener(listener);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws DownloadCancelledException if the run has been cancelled.
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new DownloadCancelledException("Download run was cancelled");
        }
    }

    private void notifyListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }
}
