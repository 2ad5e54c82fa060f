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
package org.tarik.retry.dto;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.retry.error.FailureReason;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.tarik.retry.error.FailureReason.CANCELLED;

/**
 * Terminal result of a retry session: either the value of the successful attempt or the last observed failure tagged
 * with the reason the session stopped.
 *
 * @param <V> type of the success value
 * @param <E> type of the operation failure
 */
public sealed interface Outcome<V, E extends Exception> permits Outcome.Success, Outcome.Failure {

    /**
     * Number of times the operation was invoked.
     */
    int attempts();

    /**
     * Time spent in the session, waits included.
     */
    Duration elapsed();

    boolean isSuccess();

    /**
     * Returns the success value, or throws the carried failure. A session cancelled before its first attempt throws a
     * {@link CancellationException}.
     */
    V valueOrThrow() throws E;

    default Optional<V> valueIfSuccess() {
        return this instanceof Success<V, E> success ? Optional.ofNullable(success.value()) : Optional.empty();
    }

    static <V, E extends Exception> Outcome<V, E> success(@Nullable V value, int attempts, @NotNull Duration elapsed) {
        return new Success<>(value, attempts, elapsed);
    }

    static <V, E extends Exception> Outcome<V, E> failure(@Nullable E error, @NotNull FailureReason reason,
                                                          int attempts, @NotNull Duration elapsed) {
        return new Failure<>(error, reason, attempts, elapsed);
    }

    record Success<V, E extends Exception>(@Nullable V value, int attempts, @NotNull Duration elapsed)
            implements Outcome<V, E> {
        public Success {
            checkArgument(attempts >= 1, "A successful outcome needs at least one attempt, got %s", attempts);
            checkNotNull(elapsed, "elapsed");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public V valueOrThrow() {
            return value;
        }
    }

    record Failure<V, E extends Exception>(@Nullable E error, @NotNull FailureReason reason, int attempts,
                                           @NotNull Duration elapsed) implements Outcome<V, E> {
        public Failure {
            checkNotNull(reason, "reason");
            checkNotNull(elapsed, "elapsed");
            checkArgument(error != null || reason == CANCELLED,
                    "Only a cancelled outcome may come without an error, got reason %s", reason);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public V valueOrThrow() throws E {
            if (error == null) {
                throw new CancellationException("Retry session was cancelled before the first attempt");
            }
            throw error;
        }

        public Optional<E> lastError() {
            return Optional.ofNullable(error);
        }
    }
}
