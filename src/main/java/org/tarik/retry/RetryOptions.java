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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.retry.backoff.BackoffPolicy;
import org.tarik.retry.concurrent.CancellationSignal;
import org.tarik.retry.error.RetryPredicate;

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Optional.ofNullable;

/**
 * Everything a retry session needs besides the operation itself. Options are immutable and may be reused by any
 * number of sessions, each of which starts its own backoff from the policy template.
 *
 * @param <E> type of the failure the operation signals. Exceptions of other types are not retried, they propagate
 *            to the caller.
 */
public final class RetryOptions<E extends Exception> {
    private final String name;
    private final Class<E> failureType;
    private final BackoffPolicy policy;
    private final RetryPredicate<? super E> predicate;
    private final RetryListener<? super E> listener;
    private final CancellationSignal cancellationSignal;

    private RetryOptions(Builder<E> builder) {
        this.name = builder.name;
        this.failureType = builder.failureType;
        this.policy = builder.policy;
        this.predicate = builder.predicate;
        this.listener = builder.listener;
        this.cancellationSignal = builder.cancellationSignal;
    }

    public static <E extends Exception> Builder<E> builder(@NotNull Class<E> failureType) {
        return new Builder<>(failureType);
    }

    public String getName() {
        return name;
    }

    public Class<E> getFailureType() {
        return failureType;
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    public RetryPredicate<? super E> getPredicate() {
        return predicate;
    }

    public Optional<RetryListener<? super E>> getListener() {
        return ofNullable(listener);
    }

    public CancellationSignal getCancellationSignal() {
        return cancellationSignal;
    }

    /**
     * Returns a copy of these options observing the given cancellation signal.
     */
    public RetryOptions<E> withCancellationSignal(@NotNull CancellationSignal cancellationSignal) {
        return toBuilder().cancellationSignal(cancellationSignal).build();
    }

    public Builder<E> toBuilder() {
        return new Builder<>(failureType)
                .name(name)
                .policy(policy)
                .retryWhen(predicate)
                .onRetry(listener)
                .cancellationSignal(cancellationSignal);
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("name", name)
                .add("failureType", failureType.getName())
                .add("policy", policy)
                .toString();
    }

    public static final class Builder<E extends Exception> {
        private final Class<E> failureType;
        private String name = "operation";
        private BackoffPolicy policy;
        private RetryPredicate<? super E> predicate = RetryPredicate.always();
        private RetryListener<? super E> listener;
        private CancellationSignal cancellationSignal = CancellationSignal.none();

        private Builder(Class<E> failureType) {
            this.failureType = checkNotNull(failureType, "failureType");
        }

        /**
         * Human-readable description of the retried operation, used in log messages.
         */
        public Builder<E> name(@NotNull String name) {
            this.name = checkNotNull(name, "name");
            return this;
        }

        public Builder<E> policy(@NotNull BackoffPolicy policy) {
            this.policy = checkNotNull(policy, "policy");
            return this;
        }

        /**
         * Sets the predicate deciding which failures are retried. {@code null} restores the default which retries
         * every failure until the policy is exhausted.
         */
        public Builder<E> retryWhen(@Nullable RetryPredicate<? super E> predicate) {
            this.predicate = predicate == null ? RetryPredicate.always() : predicate;
            return this;
        }

        public Builder<E> onRetry(@Nullable RetryListener<? super E> listener) {
            this.listener = listener;
            return this;
        }

        public Builder<E> cancellationSignal(@NotNull CancellationSignal cancellationSignal) {
            this.cancellationSignal = checkNotNull(cancellationSignal, "cancellationSignal");
            return this;
        }

        public RetryOptions<E> build() {
            checkState(policy != null, "A backoff policy is required for retrying '%s'", name);
            return new RetryOptions<>(this);
        }
    }
}
