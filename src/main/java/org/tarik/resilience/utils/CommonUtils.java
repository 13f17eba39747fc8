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
package org.tarik.resilience.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static java.util.Optional.empty;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

public class CommonUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CommonUtils.class);

    private CommonUtils() {
    }

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

    public static Optional<Boolean> parseStringAsBoolean(String str) {
        if (isBlank(str)) {
            return empty();
        }
        return switch (str.trim().toLowerCase()) {
            case "true", "yes", "1" -> Optional.of(true);
            case "false", "no", "0" -> Optional.of(false);
            default -> empty();
        };
    }

    /**
     * Parses a comma-separated list of integers.
     *
     * @return the parsed values, or empty if any of the items is not an integer
     */
    public static Optional<Set<Integer>> parseStringAsIntegerSet(String str) {
        if (isBlank(str)) {
            return Optional.of(Set.of());
        }
        Set<Integer> values = new HashSet<>();
        for (String item : str.split(",")) {
            if (isBlank(item)) {
                continue;
            }
            var value = parseStringAsInteger(item);
            if (value.isEmpty()) {
                return empty();
            }
            values.add(value.get());
        }
        return Optional.of(Set.copyOf(values));
    }

    public static boolean isBlank(String str) {
        return str == null || str.isBlank();
    }

    public static boolean isNotBlank(String str) {
        return !isBlank(str);
    }

    public static void sleep(Duration duration) throws InterruptedException {
        if (!duration.isNegative() && !duration.isZero()) {
            NANOSECONDS.sleep(duration.toNanos());
        }
    }

    /**
     * Converts the interruption of a waiting thread into a cancellation, restoring the interrupt flag.
     */
    public static CancellationException toCancellation(InterruptedException e, String message) {
        Thread.currentThread().interrupt();
        var cancellation = new CancellationException(message);
        cancellation.initCause(e);
        return cancellation;
    }
}
