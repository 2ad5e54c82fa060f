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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.backoff.BackoffPolicy;
import org.tarik.retry.backoff.BackoffStrategy;
import org.tarik.retry.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

/**
 * Defaults of the retry engine, read from the {@value #CONFIG_FILE} classpath resource. Every key can be overridden
 * by the environment variable named next to it.
 */
public class RetryConfig {
    private static final Logger LOG = LoggerFactory.getLogger(RetryConfig.class);
    private static final String CONFIG_FILE = "retry.properties";
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value) {
    }

    // -----------------------------------------------------
    // Backoff Config
    private static final ConfigProperty<BackoffStrategy> STRATEGY = getProperty("retry.strategy", "RETRY_STRATEGY",
            "exponential", s -> stream(BackoffStrategy.values())
                    .filter(strategy -> strategy.name().equalsIgnoreCase(s))
                    .findAny()
                    .orElseThrow(() -> new IllegalArgumentException(
                            ("%s is not a supported backoff strategy. Supported ones: %s".formatted(s,
                                    Arrays.toString(BackoffStrategy.values()))))));
    private static final ConfigProperty<Long> BASE_DELAY_MILLIS = loadPropertyAsLong("retry.base.delay.millis",
            "RETRY_BASE_DELAY_MILLIS", "100");
    private static final ConfigProperty<Optional<Long>> STEP_MILLIS = loadOptionalPropertyAsLong("retry.step.millis",
            "RETRY_STEP_MILLIS");
    private static final ConfigProperty<Double> MULTIPLIER = loadPropertyAsDouble("retry.multiplier",
            "RETRY_MULTIPLIER", "2.0");
    private static final ConfigProperty<Double> JITTER_FRACTION = loadPropertyAsDouble("retry.jitter.fraction",
            "RETRY_JITTER_FRACTION", "0.0");
    private static final ConfigProperty<Optional<Long>> MAX_DELAY_MILLIS = loadOptionalPropertyAsLong(
            "retry.max.delay.millis", "RETRY_MAX_DELAY_MILLIS");
    private static final ConfigProperty<Optional<Long>> MAX_ATTEMPTS = loadOptionalPropertyAsLong("retry.max.attempts",
            "RETRY_MAX_ATTEMPTS");
    private static final ConfigProperty<Optional<Long>> MAX_TOTAL_DURATION_MILLIS = loadOptionalPropertyAsLong(
            "retry.max.total.duration.millis", "RETRY_MAX_TOTAL_DURATION_MILLIS");

    // -----------------------------------------------------
    // Scheduler Config
    private static final ConfigProperty<Integer> SCHEDULER_THREADS = loadPropertyAsInteger("retry.scheduler.threads",
            "RETRY_SCHEDULER_THREADS", "1");

    // -----------------------------------------------------
    // Backoff Config
    public static BackoffStrategy getStrategy() {
        return STRATEGY.value();
    }

    public static long getBaseDelayMillis() {
        return BASE_DELAY_MILLIS.value();
    }

    public static Optional<Long> getStepMillis() {
        return STEP_MILLIS.value();
    }

    public static double getMultiplier() {
        return MULTIPLIER.value();
    }

    public static double getJitterFraction() {
        return JITTER_FRACTION.value();
    }

    public static Optional<Long> getMaxDelayMillis() {
        return MAX_DELAY_MILLIS.value();
    }

    public static Optional<Integer> getMaxAttempts() {
        return MAX_ATTEMPTS.value().map(Math::toIntExact);
    }

    public static Optional<Long> getMaxTotalDurationMillis() {
        return MAX_TOTAL_DURATION_MILLIS.value();
    }

    /**
     * Builds a policy out of the configured values. Invalid combinations are rejected by the policy builder.
     */
    public static BackoffPolicy getDefaultBackoffPolicy() {
        BackoffPolicy.Builder builder = BackoffPolicy.builder()
                .strategy(getStrategy())
                .baseDelay(Duration.ofMillis(getBaseDelayMillis()))
                .step(getStepMillis().map(Duration::ofMillis).orElse(null))
                .multiplier(getMultiplier())
                .jitterFraction(getJitterFraction())
                .maxDelay(getMaxDelayMillis().map(Duration::ofMillis).orElse(null))
                .maxTotalDuration(getMaxTotalDurationMillis().map(Duration::ofMillis).orElse(null));
        getMaxAttempts().ifPresent(builder::maxAttempts);
        return builder.build();
    }

    // -----------------------------------------------------
    // Scheduler Config
    public static int getSchedulerThreads() {
        if (SCHEDULER_THREADS.value() <= 0) {
            throw new IllegalArgumentException("Retry scheduler thread count must be a positive integer.");
        }
        return SCHEDULER_THREADS.value();
    }

    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = RetryConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from " + CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file " + CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static Optional<String> getProperty(String key, String envVar) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            LOG.info("Using environment variable '{}' for key '{}' with value '{}'", envVar, key,
                    envVariableOptional.get());
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                LOG.info("Using property file value for key '{}' with value '{}'", key,
                        propertyFileValueOptional.get());
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue) {
        return getProperty(key, envVar).orElseGet(() -> {
            LOG.info("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static <T> ConfigProperty<T> getProperty(String key, String envVar, String defaultValue,
            Function<String, T> converter) {
        String value = getProperty(key, envVar, defaultValue);
        return new ConfigProperty<>(converter.apply(value));
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue) {
        String rawValue = getProperty(propertyKey, envVar, defaultValue);
        Integer value = CommonUtils.parseStringAsInteger(rawValue)
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey,
                                rawValue)));
        return new ConfigProperty<>(value);
    }

    private static ConfigProperty<Long> loadPropertyAsLong(String propertyKey, String envVar, String defaultValue) {
        String rawValue = getProperty(propertyKey, envVar, defaultValue);
        Long value = CommonUtils.parseStringAsLong(rawValue)
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct long value:%s".formatted(propertyKey,
                                rawValue)));
        return new ConfigProperty<>(value);
    }

    private static ConfigProperty<Optional<Long>> loadOptionalPropertyAsLong(String propertyKey, String envVar) {
        Optional<Long> value = getProperty(propertyKey, envVar)
                .map(s -> CommonUtils.parseStringAsLong(s)
                        .orElseThrow(() -> new IllegalArgumentException(
                                "The value of property '%s' is not a correct long value:%s".formatted(propertyKey,
                                        s))));
        if (value.isEmpty()) {
            LOG.info("No value for optional key '{}', leaving it unset", propertyKey);
        }
        return new ConfigProperty<>(value);
    }

    private static ConfigProperty<Double> loadPropertyAsDouble(String propertyKey, String envVar, String defaultValue) {
        String rawValue = getProperty(propertyKey, envVar, defaultValue);
        Double value = CommonUtils.parseStringAsDouble(rawValue)
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct double value:%s".formatted(propertyKey,
                                rawValue)));
        return new ConfigProperty<>(value);
    }
}
