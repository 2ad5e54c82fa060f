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
package org.tarik.retry.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

public class CommonUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CommonUtils.class);

    public static Optional<Integer> parseStringAsInteger(String str) {
        if (isBlank(str)) {
            return empty();
        }
        try {
            return Optional.of(Integer.parseInt(str.trim()));
        } catch (NumberFormatException e) {
            LOG.error("Failed to parse string as integer: '{}'", str, e);
            return empty();
        }
    }

    public static Optional<Long> parseStringAsLong(String str) {
        if (isBlank(str)) {
            return empty();
        }
        try {
            return Optional.of(Long.parseLong(str.trim()));
        } catch (NumberFormatException e) {
            LOG.error("Failed to parse string as long: '{}'", str, e);
            return empty();
        }
    }

    public static Optional<Double> parseStringAsDouble(String str) {
        if (isBlank(str)) {
            return empty();
        }
        try {
            return Optional.of(Double.parseDouble(str.trim()));
        } catch (NumberFormatException e) {
            return empty();
        }
    }

    public static boolean isBlank(String str) {
        return str == null || str.isBlank();
    }

    public static boolean isNotBlank(String str) {
        return !isBlank(str);
    }

    /**
     * Converts the duration into nanoseconds, clamping instead of overflowing for durations which don't fit into
     * a {@code long}.
     */
    public static long toNanosSaturated(@NotNull Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    public static String describe(@NotNull Duration duration) {
        return "%dms".formatted(NANOSECONDS.toMillis(toNanosSaturated(duration)));
    }
}
