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

import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;
import static org.tarik.retry.utils.CommonUtils.toNanosSaturated;

/**
 * Immutable template describing how long to wait between attempts and when to stop retrying.
 * <p>
 * A policy holds no progress state and can be shared freely. Every retry session obtains its own {@link Backoff}
 * through {@link #start(Ticker)}, so attempt counters and elapsed time never leak from one session into another.
 * <p>
 * A policy without both {@code maxAttempts} and {@code maxTotalDuration} never exhausts on its own: the caller then
 * relies on the retry predicate or on cancellation to end the session.
 */
public final class BackoffPolicy {
    private static final Logger LOG = LoggerFactory.getLogger(BackoffPolicy.class);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);

    private final BackoffStrategy strategy;
    private final Duration baseDelay;
    private final Duration step;
    private final double multiplier;
    private final double jitterFraction;
    private final Duration maxDelay;
    private final Integer maxAttempts;
    private final Duration maxTotalDuration;
    private final DoubleSupplier jitterSource;

    private BackoffPolicy(Builder builder) {
        this.strategy = builder.strategy;
        this.baseDelay = builder.baseDelay;
        this.step = builder.step == null ? builder.baseDelay : builder.step;
        this.multiplier = builder.multiplier;
        this.jitterFraction = builder.jitterFraction;
        this.maxDelay = builder.maxDelay;
        this.maxAttempts = builder.maxAttempts;
        this.maxTotalDuration = builder.maxTotalDuration;
        this.jitterSource = builder.jitterSource;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder fixed(@NotNull Duration delay) {
        return builder().strategy(BackoffStrategy.FIXED).baseDelay(delay);
    }

    public static Builder linear(@NotNull Duration baseDelay, @NotNull Duration step) {
        return builder().strategy(BackoffStrategy.LINEAR).baseDelay(baseDelay).step(step);
    }

    public static Builder exponential(@NotNull Duration baseDelay) {
        return builder().strategy(BackoffStrategy.EXPONENTIAL).baseDelay(baseDelay);
    }

    /**
     * Creates fresh per-session progress state for this policy.
     */
    public Backoff start(@NotNull Ticker ticker) {
        return new Backoff(this, new RetryState(ticker));
    }

    public Backoff start() {
        return start(Ticker.systemTicker());
    }

    /**
     * Returns the delay to wait after the failure with the given 0-based index, or an empty optional if the policy is
     * exhausted. Apart from the jitter draw the result only depends on the two arguments.
     *
     * @param attemptIndex number of failures observed so far, not counting the one being handled
     * @param elapsed      time spent in the session so far
     */
    public Optional<Duration> nextDelay(int attemptIndex, @NotNull Duration elapsed) {
        checkArgument(attemptIndex >= 0, "Attempt index must not be negative, got %s", attemptIndex);
        checkNotNull(elapsed, "elapsed");
        if (maxAttempts != null && attemptIndex >= maxAttempts) {
            return empty();
        }
        Duration delay = applyJitter(computeDelay(attemptIndex));
        if (maxTotalDuration != null) {
            long elapsedNanos = toNanosSaturated(elapsed);
            long budgetNanos = toNanosSaturated(maxTotalDuration);
            if (elapsedNanos >= budgetNanos || LongMath.saturatedAdd(elapsedNanos, delay.toNanos()) > budgetNanos) {
                return empty();
            }
        }
        return Optional.of(delay);
    }

    /**
     * Returns the delay before jitter for the given 0-based attempt index. The value is never negative, never
     * decreases with a growing index and never exceeds {@code maxDelay} when one is configured.
     */
    public Duration computeDelay(int attemptIndex) {
        checkArgument(attemptIndex >= 0, "Attempt index must not be negative, got %s", attemptIndex);
        long baseNanos = toNanosSaturated(baseDelay);
        long rawNanos = switch (strategy) {
            case FIXED -> baseNanos;
            case LINEAR -> LongMath.saturatedAdd(baseNanos,
                    LongMath.saturatedMultiply(toNanosSaturated(step), attemptIndex));
            case EXPONENTIAL -> exponentialNanos(baseNanos, attemptIndex);
        };
        long capNanos = maxDelay == null ? Long.MAX_VALUE : toNanosSaturated(maxDelay);
        return Duration.ofNanos(Math.min(rawNanos, capNanos));
    }

    private long exponentialNanos(long baseNanos, int attemptIndex) {
        if (baseNanos == 0) {
            return 0;
        }
        double scaled = baseNanos * Math.pow(multiplier, attemptIndex);
        if (Double.isNaN(scaled) || scaled >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return (long) scaled;
    }

    private Duration applyJitter(Duration computed) {
        if (jitterFraction == 0 || computed.isZero()) {
            return computed;
        }
        double random = Math.min(Math.max(jitterSource.getAsDouble(), 0.0), 1.0);
        double factor = 1.0 - jitterFraction + 2.0 * jitterFraction * random;
        double jittered = computed.toNanos() * factor;
        return Duration.ofNanos(jittered >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) jittered);
    }

    public boolean isUnbounded() {
        return maxAttempts == null && maxTotalDuration == null;
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getStep() {
        return step;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getJitterFraction() {
        return jitterFraction;
    }

    public Optional<Duration> getMaxDelay() {
        return ofNullable(maxDelay);
    }

    public Optional<Integer> getMaxAttempts() {
        return ofNullable(maxAttempts);
    }

    public Optional<Duration> getMaxTotalDuration() {
        return ofNullable(maxTotalDuration);
    }

    /**
     * Returns a builder pre-populated with this policy's settings.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .strategy(strategy)
                .baseDelay(baseDelay)
                .step(step)
                .multiplier(multiplier)
                .jitterFraction(jitterFraction)
                .maxDelay(maxDelay)
                .maxTotalDuration(maxTotalDuration)
                .jitterSource(jitterSource);
        builder.maxAttempts = maxAttempts;
        return builder;
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("strategy", strategy)
                .add("baseDelay", baseDelay)
                .add("step", strategy == BackoffStrategy.LINEAR ? step : null)
                .add("multiplier", strategy == BackoffStrategy.EXPONENTIAL ? multiplier : null)
                .add("jitterFraction", jitterFraction)
                .add("maxDelay", maxDelay)
                .add("maxAttempts", maxAttempts)
                .add("maxTotalDuration", maxTotalDuration)
                .omitNullValues()
                .toString();
    }

    public static final class Builder {
        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration step;
        private double multiplier = DEFAULT_MULTIPLIER;
        private double jitterFraction;
        private Duration maxDelay;
        private Integer maxAttempts;
        private Duration maxTotalDuration;
        private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {
        }

        public Builder strategy(@NotNull BackoffStrategy strategy) {
            this.strategy = checkNotNull(strategy, "strategy");
            return this;
        }

        public Builder baseDelay(@NotNull Duration baseDelay) {
            this.baseDelay = checkNotNull(baseDelay, "baseDelay");
            return this;
        }

        /**
         * Increment added per failed attempt by the {@link BackoffStrategy#LINEAR} strategy. Defaults to the base delay.
         */
        public Builder step(@Nullable Duration step) {
            this.step = step;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
            return this;
        }

        public Builder maxDelay(@Nullable Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Maximum number of retries, not counting the initial attempt. Zero is rejected: a policy which never retries
         * is not a retry policy.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder unlimitedAttempts() {
            this.maxAttempts = null;
            return this;
        }

        public Builder maxTotalDuration(@Nullable Duration maxTotalDuration) {
            this.maxTotalDuration = maxTotalDuration;
            return this;
        }

        /**
         * Source of uniformly distributed values in {@code [0, 1)} used for jitter.
         */
        public Builder jitterSource(@NotNull DoubleSupplier jitterSource) {
            this.jitterSource = checkNotNull(jitterSource, "jitterSource");
            return this;
        }

        public BackoffPolicy build() {
            checkArgument(!baseDelay.isNegative(), "Base delay must not be negative, got %s", baseDelay);
            checkArgument(step == null || !step.isNegative(), "Step must not be negative, got %s", step);
            checkArgument(multiplier >= 1.0 && !Double.isInfinite(multiplier),
                    "Multiplier must be a finite value not less than 1.0, got %s", multiplier);
            checkArgument(jitterFraction >= 0.0 && jitterFraction <= 1.0,
                    "Jitter fraction must be within [0, 1], got %s", jitterFraction);
            checkArgument(maxDelay == null || maxDelay.compareTo(baseDelay) >= 0,
                    "Max delay %s must not be less than the base delay %s", maxDelay, baseDelay);
            checkArgument(maxAttempts == null || maxAttempts >= 1,
                    "Max attempts must be at least 1, got %s. Use a single invocation instead of a retry policy " +
                            "if no retries are wanted.", maxAttempts);
            checkArgument(maxTotalDuration == null || !maxTotalDuration.isNegative(),
                    "Max total duration must not be negative, got %s", maxTotalDuration);
            BackoffPolicy policy = new BackoffPolicy(this);
            if (policy.isUnbounded()) {
                LOG.warn("Backoff policy {} has neither max attempts nor max total duration, it will retry until the " +
                        "predicate rejects a failure or the session is cancelled", policy);
            }
            return policy;
        }
    }
}
