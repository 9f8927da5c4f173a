package me.golemcore.admission.resilience;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.admission.domain.exception.CircuitOpenException;
import me.golemcore.admission.domain.exception.DeadlineExceededException;
import me.golemcore.admission.domain.exception.RetryableException;
import me.golemcore.admission.domain.exception.TerminalException;
import me.golemcore.admission.domain.model.ErrorClass;
import me.golemcore.admission.domain.model.ErrorClassification;
import me.golemcore.admission.domain.model.FailureRecord;
import me.golemcore.admission.domain.model.Outcome;
import me.golemcore.admission.domain.model.RetryAttempt;
import me.golemcore.admission.domain.model.RetryContext;
import me.golemcore.admission.infrastructure.config.AdmissionProperties.RetryProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Retries calls to one dependency according to its {@link RetryProperties}.
 *
 * <p>
 * Attempts run on the calling thread, at most {@code maxRetries + 1} times.
 * Failures are classified by the dependency's {@link ErrorClassifier};
 * authentication, validation and missing-resource errors are never retried,
 * unclassified errors only when the dependency answered with a 5xx status.
 * Between attempts the thread parks for the delay computed by the
 * {@link BackoffCalculator}, shortened to the caller's deadline when one is
 * set.
 *
 * <p>
 * A call that is given up is routed once through the {@link FailureRouter} and
 * surfaces as a {@link TerminalException} carrying the original error. A
 * {@link CircuitOpenException} on the first attempt is a rejection, not a
 * failure, and propagates unchanged. Once a dependency failure has been seen, a
 * rejection ends the call like an exhausted retry budget, with the rejection
 * attached as suppressed.
 *
 * @since 1.0
 */
@Slf4j
public class RetryExecutor {

    private static final String LOG_PREFIX = "[Retry]";

    private final String dependency;
    private final RetryProperties properties;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoff;
    private final FailureRouter failureRouter;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryExecutor(String dependency, RetryProperties properties, ErrorClassifier classifier,
            BackoffCalculator backoff, FailureRouter failureRouter, Sleeper sleeper, Clock clock) {
        this.dependency = dependency;
        this.properties = properties;
        this.classifier = classifier;
        this.backoff = backoff;
        this.failureRouter = failureRouter;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public String getDependency() {
        return dependency;
    }

    /**
     * Runs the callable with retries, classifying its exceptions.
     *
     * @throws TerminalException
     *             when the call failed for good
     * @throws CircuitOpenException
     *             when a circuit breaker rejected the first attempt
     */
    public <T> T execute(RetryContext context, Callable<T> operation) {
        return executeOutcome(context, adapt(operation));
    }

    /**
     * Runs the outcome-reporting operation with retries.
     *
     * @throws TerminalException
     *             when the call failed for good
     * @throws CircuitOpenException
     *             when a circuit breaker rejected the first attempt
     */
    public <T> T executeOutcome(RetryContext context, ResilientOperation<T> operation) {
        int maxRetries = Math.max(0, properties.getMaxRetries());
        List<RetryAttempt> history = new ArrayList<>();
        Outcome<T> last = null;
        int attempts = 0;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (context.isExpired(clock)) {
                throw deadlineExceeded(context, last, history, attempts);
            }

            Outcome<T> outcome;
            try {
                outcome = operation.attempt();
            } catch (CircuitOpenException e) {
                if (last == null) {
                    throw e;
                }
                throw rejectedAfterFailures(context, last, history, attempts, e);
            }
            attempts++;
            if (outcome.isSuccess()) {
                if (attempt > 0) {
                    log.info("{} {}.{} recovered after {} retry(ies)", LOG_PREFIX, dependency,
                            context.getOperation(), attempt);
                }
                return outcome.getValue();
            }

            last = outcome;
            if (!outcome.isRetryable() || attempt == maxRetries) {
                break;
            }

            ErrorClassification classification = classificationOf(outcome);
            Duration delay = backoff.delayFor(attempt, classification);
            Optional<Duration> remaining = context.remaining(clock);
            if (remaining.isPresent() && remaining.get().compareTo(delay) < 0) {
                delay = remaining.get();
            }
            history.add(new RetryAttempt(attempts, delay, classification, outcome.getError()));
            log.warn("{} {}.{} attempt {}/{} failed with {}, retrying in {}ms", LOG_PREFIX, dependency,
                    context.getOperation(), attempts, maxRetries + 1, classification.getErrorClass(),
                    delay.toMillis());

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                Throwable error = errorOf(outcome);
                FailureRecord failure = route(context, classification, error, history, attempts);
                TerminalException terminal = new TerminalException(
                        dependency + " call interrupted during retry backoff", error, failure, classification);
                terminal.addSuppressed(ie);
                throw terminal;
            }
        }

        ErrorClassification classification = classificationOf(last);
        Throwable error = errorOf(last);
        FailureRecord failure = route(context, classification, error, history, attempts);
        throw new TerminalException(
                String.format("%s.%s failed after %d attempt(s): %s", dependency, context.getOperation(),
                        attempts, error.getMessage()),
                error, failure, classification);
    }

    /**
     * Wraps a callable into an outcome-reporting operation using this
     * executor's classifier and retry policy.
     */
    public <T> ResilientOperation<T> adapt(Callable<T> operation) {
        return () -> {
            try {
                return Outcome.success(operation.call());
            } catch (CircuitOpenException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.terminal(ErrorClassification.of(ErrorClass.UNCLASSIFIED), e);
            } catch (Exception e) {
                return toOutcome(e);
            }
        };
    }

    <T> Outcome<T> toOutcome(Exception error) {
        if (error instanceof RetryableException retryable) {
            ErrorClassification classification = retryable.getClassification() != null
                    ? retryable.getClassification()
                    : ErrorClassification.of(ErrorClass.UNCLASSIFIED);
            return Outcome.retryable(classification, error);
        }
        if (error instanceof TerminalException terminal) {
            ErrorClassification classification = terminal.getClassification() != null
                    ? terminal.getClassification()
                    : ErrorClassification.of(ErrorClass.UNCLASSIFIED);
            return Outcome.terminal(classification, error);
        }
        ErrorClassification classification = classifier.classify(error);
        return isRetryable(classification)
                ? Outcome.retryable(classification, error)
                : Outcome.terminal(classification, error);
    }

    boolean isRetryable(ErrorClassification classification) {
        ErrorClass errorClass = classification.getErrorClass();
        if (errorClass == null || errorClass.isCallerFault()) {
            return false;
        }
        if (errorClass == ErrorClass.UNCLASSIFIED) {
            return classification.isServerSide();
        }
        return properties.getRetryableErrorClasses().contains(errorClass);
    }

    private <T> DeadlineExceededException deadlineExceeded(RetryContext context, Outcome<T> last,
            List<RetryAttempt> history, int attempts) {
        String message = String.format("%s.%s deadline %s exceeded after %d attempt(s)", dependency,
                context.getOperation(), context.getDeadline(), attempts);
        if (last == null) {
            log.warn("{} {}", LOG_PREFIX, message);
            return new DeadlineExceededException(message);
        }
        ErrorClassification classification = classificationOf(last);
        Throwable error = errorOf(last);
        FailureRecord failure = route(context, classification, error, history, attempts);
        return new DeadlineExceededException(message, error, failure, classification);
    }

    private <T> TerminalException rejectedAfterFailures(RetryContext context, Outcome<T> last,
            List<RetryAttempt> history, int attempts, CircuitOpenException rejection) {
        ErrorClassification classification = classificationOf(last);
        Throwable error = errorOf(last);
        log.warn("{} {}.{} circuit opened after attempt {}, giving up", LOG_PREFIX, dependency,
                context.getOperation(), attempts);
        FailureRecord failure = route(context, classification, error, history, attempts);
        TerminalException terminal = new TerminalException(
                String.format("%s.%s failed after %d attempt(s), circuit open: %s", dependency,
                        context.getOperation(), attempts, error.getMessage()),
                error, failure, classification);
        terminal.addSuppressed(rejection);
        return terminal;
    }

    private FailureRecord route(RetryContext context, ErrorClassification classification, Throwable error,
            List<RetryAttempt> history, int attempts) {
        return failureRouter.route(dependency, context, classification, error, history, attempts);
    }

    private static <T> ErrorClassification classificationOf(Outcome<T> outcome) {
        return outcome.getClassification() != null
                ? outcome.getClassification()
                : ErrorClassification.of(ErrorClass.UNCLASSIFIED);
    }

    private static <T> Throwable errorOf(Outcome<T> outcome) {
        return outcome.getError() != null
                ? outcome.getError()
                : new IllegalStateException("Operation failed without reporting an error");
    }
}
