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
package org.tarik.resilience.error;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Arrays.asList;
import static org.tarik.resilience.error.FailureKind.*;

/**
 * The set of failure kinds which a single retrying execution treats as retryable.
 *
 * @param kinds    Ordered retryable kinds. Empty if {@code catchAll} is set.
 * @param catchAll Whether every {@link Exception} is retryable, classified or not.
 */
public record RetryableFailures(List<FailureKind> kinds, boolean catchAll) {
    private static final RetryableFailures ANY = new RetryableFailures(List.of(), true);

    public RetryableFailures {
        kinds = List.copyOf(kinds);
        checkArgument(catchAll || !kinds.isEmpty(), "At least one retryable failure kind must be provided");
    }

    public static RetryableFailures any() {
        return ANY;
    }

    public static RetryableFailures of(FailureKind first, FailureKind... others) {
        List<FailureKind> kinds = new ArrayList<>();
        kinds.add(first);
        kinds.addAll(asList(others));
        return new RetryableFailures(kinds, false);
    }

    /**
     * Kinds which are worth retrying when calling external services: transport failures, failed data fetches,
     * unusable model responses and agent timeouts.
     */
    public static RetryableFailures transientFailures() {
        return of(API, DATA_FETCH, MODEL_RESPONSE, AGENT_TIMEOUT);
    }

    public boolean contains(FailureKind kind) {
        return catchAll || kinds.stream().anyMatch(kind::isA);
    }

    /**
     * Decides whether the given failure should be retried. Cancellation signals and JVM errors are never
     * retryable.
     */
    public boolean isRetryable(Throwable failure, FailureClassifier classifier) {
        if (isCancellation(failure) || !(failure instanceof Exception)) {
            return false;
        }
        if (catchAll) {
            return true;
        }
        return classifier.classify(failure)
                .map(this::contains)
                .orElse(false);
    }

    public static boolean isCancellation(Throwable failure) {
        return failure instanceof CancellationException || failure instanceof InterruptedException;
    }

    @Override
    public String toString() {
        return catchAll ? "ANY" : kinds.toString();
    }
}
