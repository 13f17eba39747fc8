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

package org.tarik.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.resilience.error.RetryPolicy;
import org.tarik.resilience.exceptions.PlatformException;
import org.tarik.resilience.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;
import static org.tarik.resilience.error.FailureKind.CONFIGURATION;

public class ResilienceConfig {
    private static final Logger LOG = LoggerFactory.getLogger(ResilienceConfig.class);

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    // -----------------------------------------------------
    // Constants
    private static final String CONFIG_FILE = "config.properties";
    private static final Properties properties = loadConfigPropertiesFromFile();

    // Retry Policy Config
    private static final ConfigProperty<Integer> MAX_RETRIES = loadPropertyAsInteger("retry.max.retries",
            "RETRY_MAX_RETRIES", "3", false);
    private static final ConfigProperty<Double> INITIAL_DELAY_SECONDS = loadPropertyAsDouble(
            "retry.initial.delay.seconds", "RETRY_INITIAL_DELAY_SECONDS", "1.0", false);
    private static final ConfigProperty<Double> MAX_DELAY_SECONDS = loadPropertyAsDouble("retry.max.delay.seconds",
            "RETRY_MAX_DELAY_SECONDS", "60.0", false);
    private static final ConfigProperty<Double> EXPONENTIAL_BASE = loadPropertyAsDouble("retry.exponential.base",
            "RETRY_EXPONENTIAL_BASE", "2.0", false);
    private static final ConfigProperty<Boolean> JITTER_ENABLED = loadProperty("retry.jitter.enabled",
            "RETRY_JITTER_ENABLED", "true", CommonUtils::parseStringAsBoolean, false);
    private static final ConfigProperty<Double> JITTER_MIN = loadPropertyAsDouble("retry.jitter.min",
            "RETRY_JITTER_MIN", "0.5", false);
    private static final ConfigProperty<Double> JITTER_MAX = loadPropertyAsDouble("retry.jitter.max",
            "RETRY_JITTER_MAX", "1.5", false);

    // Failure Classification Config
    private static final ConfigProperty<Set<Integer>> RETRYABLE_HTTP_STATUS_CODES = loadProperty(
            "retry.http.status.codes", "RETRY_HTTP_STATUS_CODES", "429,500,502,503,504",
            CommonUtils::parseStringAsIntegerSet, false);

    // Async Config
    private static final ConfigProperty<Integer> SCHEDULER_THREADS = loadPropertyAsInteger("retry.scheduler.threads",
            "RETRY_SCHEDULER_THREADS", "1", false);

    // -----------------------------------------------------
    // Retry Policy Config
    public static int getMaxRetries() {
        return MAX_RETRIES.value();
    }

    public static Duration getInitialDelay() {
        return secondsToDuration(INITIAL_DELAY_SECONDS.value());
    }

    public static Duration getMaxDelay() {
        return secondsToDuration(MAX_DELAY_SECONDS.value());
    }

    public static double getExponentialBase() {
        return EXPONENTIAL_BASE.value();
    }

    public static boolean isJitterEnabled() {
        return JITTER_ENABLED.value();
    }

    public static double getJitterMin() {
        return JITTER_MIN.value();
    }

    public static double getJitterMax() {
        return JITTER_MAX.value();
    }

    /**
     * Assembles the retry policy which is used whenever a caller doesn't provide its own one.
     */
    public static RetryPolicy getDefaultRetryPolicy() {
        try {
            return new RetryPolicy(getMaxRetries(), getInitialDelay(), getMaxDelay(), getExponentialBase(),
                    isJitterEnabled(), getJitterMin(), getJitterMax());
        } catch (IllegalArgumentException e) {
            throw new PlatformException("Configured retry policy is invalid: " + e.getMessage(), CONFIGURATION, e);
        }
    }

    // -----------------------------------------------------
    // Failure Classification Config
    public static Set<Integer> getRetryableHttpStatusCodes() {
        return RETRYABLE_HTTP_STATUS_CODES.value();
    }

    // -----------------------------------------------------
    // Async Config
    public static int getSchedulerThreads() {
        int threads = SCHEDULER_THREADS.value();
        if (threads <= 0) {
            throw new PlatformException("Retry scheduler thread count must be a positive integer.", CONFIGURATION);
        }
        return threads;
    }

    // -----------------------------------------------------
    // Loading
    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = ResilienceConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.warn("Cannot find resource file '{}' in classpath, built-in defaults will be used.", CONFIG_FILE);
                return properties;
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file {}", CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue,
            Function<String, Optional<T>> converter, boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        T convertedValue = converter.apply(value).orElseThrow(() -> new PlatformException(
                "The value of property '%s' is not valid: %s".formatted(key, isSecret ? "***" : value),
                CONFIGURATION));
        return new ConfigProperty<>(convertedValue, isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.info("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar,
            String defaultValue, boolean isSecret) {
        return loadProperty(propertyKey, envVar, defaultValue, CommonUtils::parseStringAsInteger, isSecret);
    }

    private static ConfigProperty<Double> loadPropertyAsDouble(String propertyKey, String envVar, String defaultValue,
            boolean isSecret) {
        return loadProperty(propertyKey, envVar, defaultValue, CommonUtils::parseStringAsDouble, isSecret);
    }

    private static Duration secondsToDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }
}
