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
 * Suspends a blocking retry session between two attempts.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Waits for the given delay unless the signal is raised first.
     *
     * @return true if the whole delay elapsed, false if the wait was cut short by the cancellation signal
     * @throws InterruptedException if the waiting thread was interrupted
     */
    boolean sleep(@NotNull Duration delay, @NotNull CancellationSignal signal) throws InterruptedException;
}
