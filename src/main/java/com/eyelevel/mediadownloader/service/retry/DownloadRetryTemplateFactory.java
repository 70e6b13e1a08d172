package com.eyelevel.mediadownloader.service.retry;

import com.eyelevel.mediadownloader.config.DownloadProperties;
import com.eyelevel.mediadownloader.model.DownloadJob;
import lombok.RequiredArgsConstructor;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link RetryTemplate} that drives one job's attempts. The attempt budget comes from
 * the job; backoff timing comes from configuration.
 */
@Component
@RequiredArgsConstructor
public class DownloadRetryTemplateFactory {

    private final DownloadProperties properties;
    private final FailureClassifier classifier;
    private final DownloadRetryListener retryListener;
    private final Sleeper sleeper;

    public RetryTemplate create(DownloadJob job) {
        RetryStateMachine stateMachine = stateMachineFor(job);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(stateMachine.getInitialDelayMs());
        backOffPolicy.setMultiplier(stateMachine.getMultiplier());
        backOffPolicy.setMaxInterval(stateMachine.getMaxDelayMs());
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new ClassifiedRetryPolicy(stateMachine, classifier));
        template.setBackOffPolicy(backOffPolicy);
        template.setThrowLastExceptionOnExhausted(true);
        template.registerListener(retryListener);
        return template;
    }

    public RetryStateMachine stateMachineFor(DownloadJob job) {
        DownloadProperties.Retry retry = properties.getRetry();
        return new RetryStateMachine(job.maxAttempts(), retry.getInitialDelayMs(), retry.getMultiplier(),
                retry.getMaxDelayMs());
    }
}
