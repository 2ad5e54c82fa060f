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
package org.tarik.retry.concurrent;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Default {@link Sleeper} which parks the calling thread on the cancellation signal itself, so a cancellation wakes
 * it up immediately.
 */
public class ThreadSleeper implements Sleeper {
    private static final ThreadSleeper INSTANCE = new ThreadSleeper();

    public static ThreadSleeper getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean sleep(@NotNull Duration delay, @NotNull CancellationSignal signal) throws InterruptedException {
        if (signal.isCancelled()) {
            return false;
        }
        return !signal.await(delay);
    }
}
