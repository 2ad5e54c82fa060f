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
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.concurrent.CancellationSignal;
import org.tarik.retry.dto.Outcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.Executors.newScheduledThreadPool;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static org.tarik.retry.utils.CommonUtils.toNanosSaturated;

/**
 * Retries asynchronous operations without blocking any thread between attempts: the next attempt is scheduled on a
 * {@link ScheduledExecutorService} once the delay has passed.
 * <p>
 * Raising the cancellation signal while a session waits completes its future right away with a
 * {@link org.tarik.retry.error.FailureReason#CANCELLED CANCELLED} outcome. A signal raised while an attempt is in
 * flight is left for the operation to honor; the session observes it once the attempt completes. Cancelling the
 * returned future stops the session as well.
 */
public class AsyncRetryExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AsyncRetryExecutor.class);
    private final ScheduledExecutorService scheduler;
    private final Ticker ticker;
    private final boolean ownsScheduler;

    private AsyncRetryExecutor(ScheduledExecutorService scheduler, Ticker ticker, boolean ownsScheduler) {
        this.scheduler = checkNotNull(scheduler, "scheduler");
        this.ticker = checkNotNull(ticker, "ticker");
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Creates an executor with its own daemon scheduler sized by {@link RetryConfig#getSchedulerThreads()}. The
     * scheduler is shut down by {@link #close()}.
     */
    public static AsyncRetryExecutor create() {
        var threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("retry-scheduler-%d")
                .setDaemon(true)
                .build();
        return new AsyncRetryExecutor(newScheduledThreadPool(RetryConfig.getSchedulerThreads(), threadFactory),
                Ticker.systemTicker(), true);
    }

    /**
     * Creates an executor on top of a scheduler owned by the caller, which stays responsible for shutting it down.
     */
    public static AsyncRetryExecutor using(@NotNull ScheduledExecutorService scheduler) {
        return using(scheduler, Ticker.systemTicker());
    }

    public static AsyncRetryExecutor using(@NotNull ScheduledExecutorService scheduler, @NotNull Ticker ticker) {
        return new AsyncRetryExecutor(scheduler, ticker, false);
    }

    /**
     * Starts a session. The first attempt runs on the calling thread, the following ones on the scheduler.
     */
    public <V, E extends Exception> CompletableFuture<Outcome<V, E>> execute(
            @NotNull Supplier<? extends AsyncOperation<? extends V>> operationFactory,
            @NotNull RetryOptions<E> options) {
        checkNotNull(operationFactory, "operationFactory");
        var loop = new AttemptLoop<V, E>(new RetrySession<>(options, ticker), operationFactory,
                options.getCancellationSignal());
        loop.start();
        return loop.result;
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            LOG.debug("Shutting down the retry scheduler");
            scheduler.shutdownNow();
        }
    }

    private enum LoopState {
        RUNNING, WAITING, DONE
    }

    private class AttemptLoop<V, E extends Exception> {
        private final RetrySession<V, E> session;
        private final Supplier<? extends AsyncOperation<? extends V>> operationFactory;
        private final CancellationSignal signal;
        private final CompletableFuture<Outcome<V, E>> result = new CompletableFuture<>();
        private LoopState state = LoopState.RUNNING;
        private ScheduledFuture<?> pendingAttempt;
        private CancellationSignal.Registration registration;

        AttemptLoop(RetrySession<V, E> session, Supplier<? extends AsyncOperation<? extends V>> operationFactory,
                    CancellationSignal signal) {
            this.session = session;
            this.operationFactory = operationFactory;
            this.signal = signal;
        }

        void start() {
            result.whenComplete((outcome, throwable) -> cleanUp());
            synchronized (this) {
                registration = signal.onCancel(this::onCancelled);
            }
            attempt();
        }

        private void attempt() {
            boolean cancelled;
            synchronized (this) {
                if (state == LoopState.DONE) {
                    return;
                }
                cancelled = session.isCancelled();
                if (!cancelled) {
                    state = LoopState.RUNNING;
                    pendingAttempt = null;
                }
            }
            if (cancelled) {
                complete(session.cancelled());
                return;
            }

            CompletionStage<? extends V> stage;
            try {
                stage = checkNotNull(session.<AsyncOperation<? extends V>>nextAttempt(operationFactory).call(),
                        "Operation of '%s' returned a null stage", session.getName());
            } catch (RuntimeException e) {
                onAttemptFailed(e);
                return;
            }
            stage.whenComplete((value, throwable) -> {
                if (throwable == null) {
                    complete(session.succeeded(value));
                } else {
                    onAttemptFailed(throwable);
                }
            });
        }

        private void onAttemptFailed(Throwable throwable) {
            Throwable cause = unwrap(throwable);
            E failure = session.asFailure(cause);
            if (failure == null) {
                session.logForeignFailure(cause);
                completeExceptionally(cause);
                return;
            }
            Outcome<V, E> terminal = session.handleFailure(failure);
            if (terminal != null) {
                complete(terminal);
                return;
            }
            boolean cancelled;
            try {
                cancelled = scheduleNextAttempt();
            } catch (RejectedExecutionException e) {
                LOG.error("Couldn't schedule the next attempt of '{}'", session.getName(), e);
                completeExceptionally(e);
                return;
            }
            if (cancelled) {
                result.complete(session.cancelled());
            }
        }

        /**
         * Schedules the pending attempt unless the signal was raised after the failure had been handled. Returns true
         * if the loop was finished because of such a cancellation instead.
         */
        private synchronized boolean scheduleNextAttempt() {
            if (state == LoopState.DONE) {
                return false;
            }
            if (session.isCancelled()) {
                state = LoopState.DONE;
                return true;
            }
            pendingAttempt = scheduler.schedule(this::attempt, toNanosSaturated(session.getPendingDelay()),
                    NANOSECONDS);
            state = LoopState.WAITING;
            return false;
        }

        private void onCancelled() {
            if (markDone(LoopState.WAITING)) {
                result.complete(session.cancelled());
            }
        }

        private void complete(Outcome<V, E> outcome) {
            if (markDone(null)) {
                result.complete(outcome);
            }
        }

        private void completeExceptionally(Throwable throwable) {
            if (markDone(null)) {
                result.completeExceptionally(throwable);
            }
        }

        /**
         * Moves the loop to its final state, provided it isn't there yet and, if given, is in the expected state.
         */
        private synchronized boolean markDone(@Nullable LoopState expected) {
            if (state == LoopState.DONE || (expected != null && state != expected)) {
                return false;
            }
            state = LoopState.DONE;
            return true;
        }

        private synchronized void cleanUp() {
            state = LoopState.DONE;
            if (pendingAttempt != null) {
                pendingAttempt.cancel(false);
                pendingAttempt = null;
            }
            if (registration != null) {
                registration.close();
            }
        }

        private Throwable unwrap(Throwable throwable) {
            Throwable current = throwable;
            while ((current instanceof CompletionException || current instanceof ExecutionException)
                    && current.getCause() != null) {
                current = current.getCause();
            }
            return current;
        }
    }
}
