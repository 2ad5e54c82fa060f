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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.backoff.BackoffPolicy;
import org.tarik.retry.concurrent.CancellationSignal;
import org.tarik.retry.concurrent.Sleeper;
import org.tarik.retry.concurrent.ThreadSleeper;
import org.tarik.retry.dto.Outcome;
import org.tarik.retry.error.RetryPredicate;

import java.time.Duration;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Throwables.throwIfUnchecked;

/**
 * Retries operations on the calling thread, which is suspended between attempts. A session ends on the first
 * success, when the retry predicate rejects a failure, when the backoff policy is exhausted, or when the cancellation
 * signal is raised (or the thread interrupted) during a wait.
 * <p>
 * Exceptions which are not of the configured failure type are not operation failures: they propagate to the caller
 * unchanged.
 */
public class RetryExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);
    private final Sleeper sleeper;
    private final Ticker ticker;

    private RetryExecutor(Builder builder) {
        this.sleeper = builder.sleeper;
        this.ticker = builder.ticker;
    }

    public static RetryExecutor create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the session described by the options, invoking the factory once per attempt for a fresh operation.
     */
    public <V, E extends Exception> Outcome<V, E> execute(
            @NotNull Supplier<? extends Operation<? extends V, ? extends E>> operationFactory,
            @NotNull RetryOptions<E> options) {
        checkNotNull(operationFactory, "operationFactory");
        RetrySession<V, E> session = new RetrySession<>(options, ticker);
        CancellationSignal signal = options.getCancellationSignal();
        if (session.isCancelled()) {
            return session.cancelled();
        }

        while (true) {
            V value;
            try {
                value = session.<Operation<? extends V, ? extends E>>nextAttempt(operationFactory).call();
            } catch (Exception e) {
                E failure = session.asFailure(e);
                if (failure == null) {
                    session.logForeignFailure(e);
                    throwIfUnchecked(e);
                    throw new IllegalStateException("'%s' threw an undeclared checked exception"
                            .formatted(session.getName()), e);
                }
                Outcome<V, E> terminal = session.handleFailure(failure);
                if (terminal != null) {
                    return terminal;
                }
                if (!sleep(session.getPendingDelay(), signal)) {
                    return session.cancelled();
                }
                continue;
            }
            return session.succeeded(value);
        }
    }

    /**
     * Retries the given operation instance. Use {@link #execute(Supplier, RetryOptions)} for operations which keep
     * per-attempt state.
     */
    public <V, E extends Exception> Outcome<V, E> retry(@NotNull Operation<? extends V, ? extends E> operation,
                                                        @NotNull RetryOptions<E> options) {
        checkNotNull(operation, "operation");
        return this.<V, E>execute(() -> operation, options);
    }

    /**
     * Shorthand for a session with default options apart from the policy and the predicate. A null predicate retries
     * every failure of the given type.
     */
    public <V, E extends Exception> Outcome<V, E> execute(
            @NotNull Class<E> failureType,
            @NotNull Supplier<? extends Operation<? extends V, ? extends E>> operationFactory,
            @NotNull BackoffPolicy policy,
            @Nullable RetryPredicate<? super E> predicate) {
        return this.<V, E>execute(operationFactory, RetryOptions.builder(failureType)
                .policy(policy)
                .retryWhen(predicate)
                .build());
    }

    private boolean sleep(Duration delay, CancellationSignal signal) {
        try {
            return sleeper.sleep(delay, signal);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Interrupted while waiting {} before the next attempt", delay);
            return false;
        }
    }

    public static final class Builder {
        private Sleeper sleeper = ThreadSleeper.getInstance();
        private Ticker ticker = Ticker.systemTicker();

        private Builder() {
        }

        public Builder sleeper(@NotNull Sleeper sleeper) {
            this.sleeper = checkNotNull(sleeper, "sleeper");
            return this;
        }

        /**
         * Time source for measuring the elapsed time of sessions.
         */
        public Builder ticker(@NotNull Ticker ticker) {
            this.ticker = checkNotNull(ticker, "ticker");
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
