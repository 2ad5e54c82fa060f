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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static org.tarik.retry.utils.CommonUtils.toNanosSaturated;

/**
 * One-shot, thread-safe cancellation flag observed by retry sessions while they wait between attempts. Once raised a
 * signal stays raised.
 */
public class CancellationSignal {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationSignal.class);
    private static final CancellationSignal NONE = new CancellationSignal() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared 'none' cancellation signal can't be cancelled");
        }
    };

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();

    /**
     * Returns a shared signal which is never raised.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (latch.getCount() == 0) {
                return;
            }
            latch.countDown();
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        LOG.debug("Cancellation requested, notifying {} listener(s)", toRun.size());
        toRun.forEach(CancellationSignal::runCallback);
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits for the signal to be raised, at most for the given duration.
     *
     * @return true if the signal was raised, false if the duration passed first
     */
    public boolean await(@NotNull Duration timeout) throws InterruptedException {
        return latch.await(toNanosSaturated(timeout), NANOSECONDS);
    }

    /**
     * Registers a callback executed once when the signal is raised, immediately if it already is. The callback runs
     * on the thread which raises the signal.
     */
    public Registration onCancel(@NotNull Runnable callback) {
        checkNotNull(callback, "callback");
        synchronized (callbacks) {
            if (latch.getCount() != 0) {
                callbacks.add(callback);
                return () -> {
                    synchronized (callbacks) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> {
        };
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.error("Cancellation callback failed", e);
        }
    }

    /**
     * Handle for removing a callback which is no longer interested in the signal.
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
