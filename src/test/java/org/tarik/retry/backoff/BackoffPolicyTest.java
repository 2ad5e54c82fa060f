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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static java.time.Duration.ZERO;
import static java.time.Duration.ofMillis;
import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackoffPolicy Tests")
class BackoffPolicyTest {

    @Nested
    @DisplayName("Delay computation")
    class DelayComputation {

        @Test
        @DisplayName("Fixed strategy always yields the base delay")
        void fixedStrategyYieldsConstantDelay() {
            BackoffPolicy policy = BackoffPolicy.fixed(ofMillis(250)).build();

            assertThat(policy.computeDelay(0)).isEqualTo(ofMillis(250));
            assertThat(policy.computeDelay(7)).isEqualTo(ofMillis(250));
            assertThat(policy.computeDelay(Integer.MAX_VALUE)).isEqualTo(ofMillis(250));
        }

        @Test
        @DisplayName("Linear strategy adds one step per attempt and stops at the cap")
        void linearStrategyGrowsByStepUntilCap() {
            BackoffPolicy policy = BackoffPolicy.linear(ofMillis(100), ofMillis(50))
                    .maxDelay(ofMillis(260))
                    .build();

            assertThat(policy.computeDelay(0)).isEqualTo(ofMillis(100));
            assertThat(policy.computeDelay(1)).isEqualTo(ofMillis(150));
            assertThat(policy.computeDelay(3)).isEqualTo(ofMillis(250));
            assertThat(policy.computeDelay(4)).isEqualTo(ofMillis(260));
            assertThat(policy.computeDelay(1_000)).isEqualTo(ofMillis(260));
        }

        @Test
        @DisplayName("Linear step defaults to the base delay")
        void linearStepDefaultsToBaseDelay() {
            BackoffPolicy policy = BackoffPolicy.builder()
                    .strategy(BackoffStrategy.LINEAR)
                    .baseDelay(ofMillis(40))
                    .build();

            assertThat(policy.getStep()).isEqualTo(ofMillis(40));
            assertThat(policy.computeDelay(2)).isEqualTo(ofMillis(120));
        }

        @Test
        @DisplayName("Exponential delay equals min(base * multiplier^index, cap) and never decreases")
        void exponentialDelayIsMonotonicAndBounded() {
            BackoffPolicy policy = BackoffPolicy.exponential(ofMillis(100))
                    .multiplier(2.0)
                    .maxDelay(ofSeconds(1))
                    .build();

            Duration previous = ZERO;
            for (int attemptIndex = 0; attemptIndex <= 200; attemptIndex++) {
                Duration expected = attemptIndex < 4 ? ofMillis(100L << attemptIndex) : ofSeconds(1);
                Duration delay = policy.computeDelay(attemptIndex);

                assertThat(delay).as("delay for attempt index %s", attemptIndex).isEqualTo(expected);
                assertThat(delay).isGreaterThanOrEqualTo(previous);
                previous = delay;
            }
        }

        @Test
        @DisplayName("Exponential growth saturates instead of overflowing when no cap is set")
        void exponentialGrowthSaturatesWithoutCap() {
            BackoffPolicy policy = BackoffPolicy.exponential(ofMillis(1)).maxAttempts(3).build();

            assertThat(policy.computeDelay(10_000)).isEqualTo(Duration.ofNanos(Long.MAX_VALUE));
            assertThat(policy.computeDelay(Integer.MAX_VALUE)).isEqualTo(Duration.ofNanos(Long.MAX_VALUE));
        }

        @Test
        @DisplayName("Linear growth saturates instead of overflowing when no cap is set")
        void linearGrowthSaturatesWithoutCap() {
            BackoffPolicy policy = BackoffPolicy.linear(ofMillis(1), Duration.ofDays(365)).maxAttempts(3).build();

            assertThat(policy.computeDelay(Integer.MAX_VALUE)).isEqualTo(Duration.ofNanos(Long.MAX_VALUE));
        }

        @Test
        @DisplayName("A zero base delay stays zero for every strategy")
        void zeroBaseDelayStaysZero() {
            assertThat(BackoffPolicy.exponential(ZERO).maxAttempts(1).build().computeDelay(50)).isZero();
            assertThat(BackoffPolicy.fixed(ZERO).maxAttempts(1).build().computeDelay(50)).isZero();
        }

        @Test
        @DisplayName("Negative attempt index is rejected")
        void negativeAttemptIndexIsRejected() {
            BackoffPolicy policy = BackoffPolicy.fixed(ofMillis(10)).maxAttempts(1).build();

            assertThatThrownBy(() -> policy.computeDelay(-1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> policy.nextDelay(-1, ZERO)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Jitter")
    class Jitter {

        @Test
        @DisplayName("Jitter scales the delay within [1 - j, 1 + j]")
        void jitterScalesWithinBounds() {
            Iterator<Double> randomValues = List.of(0.0, 0.5, 0.999).iterator();
            BackoffPolicy policy = BackoffPolicy.fixed(ofSeconds(1))
                    .jitterFraction(0.5)
                    .jitterSource(randomValues::next)
                    .build();

            assertThat(policy.nextDelay(0, ZERO)).contains(ofMillis(500));
            assertThat(policy.nextDelay(1, ZERO)).contains(ofSeconds(1));
            assertThat(policy.nextDelay(2, ZERO)).hasValueSatisfying(delay ->
                    assertThat(delay).isBetween(ofMillis(1498), ofMillis(1500)));
        }

        @Test
        @DisplayName("Randomized delays stay within the jitter bounds of the computed delay")
        void randomizedDelaysStayWithinBounds() {
            double jitter = 0.2;
            BackoffPolicy policy = BackoffPolicy.exponential(ofMillis(100))
                    .maxDelay(ofSeconds(1))
                    .jitterFraction(jitter)
                    .build();

            for (int attemptIndex = 0; attemptIndex < 1_000; attemptIndex++) {
                long computed = policy.computeDelay(attemptIndex % 8).toNanos();
                Optional<Duration> delay = policy.nextDelay(attemptIndex % 8, ZERO);

                assertThat(delay).isPresent();
                assertThat(delay.get().toNanos())
                        .isBetween((long) Math.floor(computed * (1 - jitter)), (long) Math.ceil(computed * (1 + jitter)));
            }
        }

        @Test
        @DisplayName("Jitter is not applied when the fraction is zero")
        void noJitterByDefault() {
            BackoffPolicy policy = BackoffPolicy.fixed(ofMillis(300))
                    .jitterSource(() -> {
                        throw new AssertionError("Random source must not be used without jitter");
                    })
                    .build();

            assertThat(policy.nextDelay(0, ZERO)).contains(ofMillis(300));
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("Policy is exhausted once the attempt index reaches max attempts")
        void exhaustedAtMaxAttempts() {
            BackoffPolicy policy = BackoffPolicy.fixed(ofMillis(10)).maxAttempts(3).build();

            assertThat(policy.nextDelay(0, ZERO)).isPresent();
            assertThat(policy.nextDelay(2, ZERO)).isPresent();
            assertThat(policy.nextDelay(3, ZERO)).isEmpty();
            assertThat(policy.nextDelay(4, ZERO)).isEmpty();
        }

        @Test
        @DisplayName("Policy is exhausted when the next delay would exceed the total duration")
        void exhaustedWhenTotalDurationWouldBeExceeded() {
            BackoffPolicy policy = BackoffPolicy.fixed(ofMillis(100)).maxTotalDuration(ofMillis(250)).build();

            assertThat(policy.nextDelay(0, ZERO)).contains(ofMillis(100));
            assertThat(policy.nextDelay(1, ofMillis(150))).contains(ofMillis(100));
            assertThat(policy.nextDelay(1, ofMillis(151))).isEmpty();
            assertThat(policy.nextDelay(1, ofMillis(250))).isEmpty();
        }

        @Test
        @DisplayName("A zero delay doesn't extend a spent time budget")
        void exhaustedWhenBudgetIsSpentEvenWithZeroDelay() {
            BackoffPolicy policy = BackoffPolicy.fixed(ZERO).maxTotalDuration(ofMillis(50)).build();

            assertThat(policy.nextDelay(5, ofMillis(49))).contains(ZERO);
            assertThat(policy.nextDelay(5, ofMillis(50))).isEmpty();
        }

        @Test
        @DisplayName("The first configured bound reached wins")
        void firstReachedBoundWins() {
            BackoffPolicy policy = BackoffPolicy.fixed(ofMillis(100))
                    .maxAttempts(10)
                    .maxTotalDuration(ofSeconds(1))
                    .build();

            assertThat(policy.nextDelay(10, ZERO)).isEmpty();
            assertThat(policy.nextDelay(2, ofMillis(950))).isEmpty();
            assertThat(policy.nextDelay(2, ofMillis(100))).isPresent();
        }

        @Test
        @DisplayName("A policy without bounds never exhausts on its own")
        void unboundedPolicyNeverExhausts() {
            BackoffPolicy policy = BackoffPolicy.fixed(ofMillis(1)).build();

            assertThat(policy.isUnbounded()).isTrue();
            assertThat(policy.nextDelay(1_000_000, Duration.ofDays(10_000))).contains(ofMillis(1));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Zero max attempts is an invalid configuration")
        void zeroMaxAttemptsIsRejected() {
            assertThatThrownBy(() -> BackoffPolicy.fixed(ofMillis(10)).maxAttempts(0).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Max attempts must be at least 1");
        }

        @Test
        @DisplayName("Invalid parameters are rejected")
        void invalidParametersAreRejected() {
            assertThatThrownBy(() -> BackoffPolicy.fixed(ofMillis(-1)).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackoffPolicy.exponential(ofMillis(10)).multiplier(0.5).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackoffPolicy.fixed(ofMillis(10)).jitterFraction(1.5).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackoffPolicy.fixed(ofMillis(10)).jitterFraction(-0.1).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackoffPolicy.fixed(ofMillis(10)).maxDelay(ofMillis(5)).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackoffPolicy.linear(ofMillis(10), ofMillis(-5)).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackoffPolicy.fixed(ofMillis(10)).maxTotalDuration(ofMillis(-5)).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Defaults are an exponential strategy with multiplier 2.0 and no jitter")
        void defaults() {
            BackoffPolicy policy = BackoffPolicy.builder().maxAttempts(2).build();

            assertThat(policy.getStrategy()).isEqualTo(BackoffStrategy.EXPONENTIAL);
            assertThat(policy.getBaseDelay()).isEqualTo(BackoffPolicy.DEFAULT_BASE_DELAY);
            assertThat(policy.getMultiplier()).isEqualTo(2.0);
            assertThat(policy.getJitterFraction()).isZero();
            assertThat(policy.getMaxDelay()).isEmpty();
            assertThat(policy.getMaxTotalDuration()).isEmpty();
            assertThat(policy.getMaxAttempts()).contains(2);
            assertThat(policy.isUnbounded()).isFalse();
        }

        @Test
        @DisplayName("toBuilder copies every setting")
        void toBuilderCopiesSettings() {
            BackoffPolicy original = BackoffPolicy.linear(ofMillis(10), ofMillis(20))
                    .maxDelay(ofMillis(70))
                    .maxAttempts(4)
                    .maxTotalDuration(ofSeconds(3))
                    .jitterFraction(0.1)
                    .build();

            BackoffPolicy copy = original.toBuilder().build();

            assertThat(copy.toString()).isEqualTo(original.toString());
            assertThat(copy.toBuilder().unlimitedAttempts().build().getMaxAttempts()).isEmpty();
        }
    }
}
