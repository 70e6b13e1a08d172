package com.eyelevel.mediadownloader.service.retry;

import com.eyelevel.mediadownloader.model.AttemptState;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * Spring Retry policy that lets the {@link RetryStateMachine} decide whether another attempt
 * follows a failure, based on how the {@link FailureClassifier} classifies it.
 * <p>
 * The decided state is stored on the context under {@link #ATTEMPT_STATE} as soon as a failure is
 * registered.
 */
public class ClassifiedRetryPolicy implements RetryPolicy {

    public static final String ATTEMPT_STATE = "download.attempt.state";

    private final RetryStateMachine stateMachine;
    private final FailureClassifier classifier;

    public ClassifiedRetryPolicy(RetryStateMachine stateMachine, FailureClassifier classifier) {
        this.stateMachine = stateMachine;
        this.classifier = classifier;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        if (context.getLastThrowable() == null) {
            return true;
        }
        return context.getAttribute(ATTEMPT_STATE) == AttemptState.BACKING_OFF;
    }

    @Override
    public RetryContext open(RetryContext parent) {
        RetryContextSupport context = new RetryContextSupport(parent);
        context.setAttribute(ATTEMPT_STATE, AttemptState.ATTEMPTING);
        return context;
    }

    @Override
    public void close(RetryContext context) {
        // Nothing to release.
    }

    @Override
    public void registerThrowable(RetryContext context, Throwable throwable) {
        ((RetryContextSupport) context).registerThrowable(throwable);
        // Decided here so that listeners notified of this failure already see the outcome.
        AttemptState next = stateMachine.next(classifier.classify(throwable), context.getRetryCount());
        context.setAttribute(ATTEMPT_STATE, next);
    }

    @Override
    public int getMaxAttempts() {
        return stateMachine.getMaxAttempts();
    }
}
