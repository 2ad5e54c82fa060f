/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
 */
package org.tarik.retry;

import com.google.common.base.Ticker;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.backoff.Backoff;
import org.tarik.retry.dto.Outcome;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static org.tarik.retry.error.FailureReason.CANCELLED;
import static org.tarik.retry.error.FailureReason.POLICY_EXHAUSTED;
import static org.tarik.retry.error.FailureReason.PREDICATE_REJECTED;
import static org.tarik.retry.utils.CommonUtils.describe;

/**
 * Bookkeeping of one execution: binds the options to a freshly started backoff, counts invocations and keeps the last
 * observed failure. Shared by the blocking and the asynchronous executors, which only differ in how they wait.
 */
class RetrySession<V, E extends Exception> {
    private static final Logger LOG = LoggerFactory.getLogger(RetrySession.class);
    private final RetryOptions<E> options;
    private final Backoff backoff;
    private int invocations;
    private E lastError;
    private Duration pendingDelay;

    RetrySession(RetryOptions<E> options, Ticker ticker) {
        this.options = checkNotNull(options, "options");
        this.backoff = options.getPolicy().start(ticker);
    }

    boolean isCancelled() {
        return options.getCancellationSignal().isCancelled();
    }

    <O> O nextAttempt(Supplier<? extends O> operationFactory) {
        invocations++;
        LOG.debug("Starting attempt {} of '{}'", invocations, options.getName());
        return checkNotNull(operationFactory.get(), "Operation factory of '%s' returned null", options.getName());
    }

    /**
     * Returns the throwable as an operation failure, or null if it isn't of the configured failure type.
     */
    @Nullable
    E asFailure(Throwable throwable) {
        Class<E> failureType = options.getFailureType();
        return failureType.isInstance(throwable) ? failureType.cast(throwable) : null;
    }

    Outcome<V, E> succeeded(@Nullable V value) {
        if (invocations > 1) {
            LOG.info("'{}' succeeded after {} attempts (elapsed: {})", options.getName(), invocations,
                    describe(backoff.getElapsedTime()));
        }
        return Outcome.success(value, invocations, backoff.getElapsedTime());
    }

    /**
     * Classifies the failure of the latest attempt. Returns the terminal outcome if the session must stop, or null if
     * another attempt is due after {@link #getPendingDelay()}.
     */
    @Nullable
    Outcome<V, E> handleFailure(E error) {
        lastError = checkNotNull(error, "error");
        pendingDelay = null;
        if (!options.getPredicate().isRetryable(error)) {
            LOG.warn("Non-retryable failure of '{}' on attempt {}: {}", options.getName(), invocations,
                    error.toString());
            return Outcome.failure(error, PREDICATE_REJECTED, invocations, backoff.getElapsedTime());
        }

        int attemptIndex = backoff.getAttemptIndex();
        Optional<Duration> delay = backoff.next();
        if (delay.isEmpty()) {
            LOG.error("'{}' failed after {} attempts (elapsed: {}). Last error: {}", options.getName(), invocations,
                    describe(backoff.getElapsedTime()), error.toString());
            return Outcome.failure(error, POLICY_EXHAUSTED, invocations, backoff.getElapsedTime());
        }
        if (isCancelled()) {
            return cancelled();
        }

        LOG.warn("Attempt {} of '{}' failed: {}. Retrying in {}...", invocations, options.getName(), error.toString(),
                describe(delay.get()));
        options.getListener().ifPresent(listener -> notifyListener(listener, attemptIndex, delay.get(), error));
        pendingDelay = delay.get();
        return null;
    }

    private void notifyListener(RetryListener<? super E> listener, int attemptIndex, Duration delay, E error) {
        try {
            listener.onRetry(attemptIndex, delay, error);
        } catch (RuntimeException e) {
            LOG.warn("Retry listener of '{}' threw an exception which is ignored", options.getName(), e);
        }
    }

    Duration getPendingDelay() {
        checkState(pendingDelay != null, "No retry of '%s' is pending", options.getName());
        return pendingDelay;
    }

    Outcome<V, E> cancelled() {
        LOG.info("'{}' was cancelled after {} attempt(s)", options.getName(), invocations);
        return Outcome.failure(lastError, CANCELLED, invocations, backoff.getElapsedTime());
    }

    void logForeignFailure(Throwable throwable) {
        LOG.error("'{}' failed on attempt {} with {} which isn't a {}, it won't be retried", options.getName(),
                invocations, throwable.getClass().getName(), options.getFailureType().getName());
    }

    String getName() {
        return options.getName();
    }
}
