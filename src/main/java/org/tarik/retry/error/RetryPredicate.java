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
package org.tarik.retry.error;

import org.jetbrains.annotations.NotNull;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decides whether a failure is worth another attempt. Implementations must be pure and must not block: the executor
 * treats the returned value as authoritative.
 *
 * @param <E> type of the failure being classified
 */
@FunctionalInterface
public interface RetryPredicate<E> {

    boolean isRetryable(@NotNull E failure);

    static <E> RetryPredicate<E> always() {
        return failure -> true;
    }

    static <E> RetryPredicate<E> never() {
        return failure -> false;
    }

    /**
     * Retries only failures which are instances of one of the given types.
     */
    @SafeVarargs
    static <E> RetryPredicate<E> retryOn(@NotNull Class<? extends E>... retryableTypes) {
        List<Class<? extends E>> types = List.of(retryableTypes);
        return failure -> types.stream().anyMatch(type -> type.isInstance(failure));
    }

    /**
     * Retries every failure except instances of the given types.
     */
    @SafeVarargs
    static <E> RetryPredicate<E> abortOn(@NotNull Class<? extends E>... permanentTypes) {
        return RetryPredicate.<E>retryOn(permanentTypes).negate();
    }

    default RetryPredicate<E> and(@NotNull RetryPredicate<? super E> other) {
        checkNotNull(other, "other");
        return failure -> isRetryable(failure) && other.isRetryable(failure);
    }

    default RetryPredicate<E> or(@NotNull RetryPredicate<? super E> other) {
        checkNotNull(other, "other");
        return failure -> isRetryable(failure) || other.isRetryable(failure);
    }

    default RetryPredicate<E> negate() {
        return failure -> !isRetryable(failure);
    }
}
