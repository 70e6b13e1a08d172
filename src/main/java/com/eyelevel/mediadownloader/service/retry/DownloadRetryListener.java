package com.eyelevel.mediadownloader.service.retry;

import com.eyelevel.mediadownloader.model.AttemptState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs every failed download attempt together with what happens next.
 */
@Slf4j
@Component("downloadRetryListener")
public class DownloadRetryListener implements RetryListener {

    /**
     * Context attribute holding the job label used to prefix log lines.
     */
    public static final String JOB_LABEL = "download.job.label";

    /**
     * Called after a failed attempt.
     *
     * @param context   The current retry context.
     * @param callback  The callback that was executed.
     * @param throwable The exception that was thrown.
     */
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        Object label = context.getAttribute(JOB_LABEL);
        String contextInfo = label != null ? label.toString() : "Unknown Job";
        Object state = context.getAttribute(ClassifiedRetryPolicy.ATTEMPT_STATE);

        if (state == AttemptState.BACKING_OFF) {
            log.warn("[{}] Attempt {} failed. Retrying... Error: {}", contextInfo, context.getRetryCount(),
                    throwable.getMessage());
        } else {
            log.debug("[{}] Attempt {} failed ({}). Error: {}", contextInfo, context.getRetryCount(), state,
                    throwable.getMessage());
        }
    }
}
