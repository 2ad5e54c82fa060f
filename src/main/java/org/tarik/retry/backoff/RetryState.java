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

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Progress of a single retry session: the number of failed attempts which have been followed by a delay and the time
 * elapsed since the session started. Instances are confined to the session which created them.
 */
public class RetryState {
    private final Stopwatch stopwatch;
    private int attempts;

    public RetryState(@NotNull Ticker ticker) {
        this.stopwatch = Stopwatch.createStarted(checkNotNull(ticker, "ticker"));
    }

    public int incrementAttempts() {
        return ++attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getElapsedTime() {
        return stopwatch.elapsed();
    }
}
