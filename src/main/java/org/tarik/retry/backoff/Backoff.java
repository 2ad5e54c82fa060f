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
package org.tarik.retry.backoff;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stateful delay generator of one retry session, created by {@link BackoffPolicy#start}. Not thread-safe: a backoff
 * belongs to exactly one session.
 */
public class Backoff {
    private final BackoffPolicy policy;
    private final RetryState state;

    Backoff(@NotNull BackoffPolicy policy, @NotNull RetryState state) {
        this.policy = checkNotNull(policy, "policy");
        this.state = checkNotNull(state, "state");
    }

    /**
     * Returns the delay to wait before the next attempt, advancing the attempt index by one, or an empty optional if
     * the policy is exhausted. An exhausted backoff keeps the attempt index unchanged.
     */
    public Optional<Duration> next() {
        Optional<Duration> delay = policy.nextDelay(state.getAttempts(), state.getElapsedTime());
        delay.ifPresent(d -> state.incrementAttempts());
        return delay;
    }

    public int getAttemptIndex() {
        return state.getAttempts();
    }

    public Duration getElapsedTime() {
        return state.getElapsedTime();
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }
}
