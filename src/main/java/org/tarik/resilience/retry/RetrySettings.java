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
package org.tarik.resilience.retry;

import org.jetbrains.annotations.Nullable;
import org.tarik.resilience.ResilienceConfig;
import org.tarik.resilience.error.DefaultFailureClassifier;
import org.tarik.resilience.error.FailureClassifier;
import org.tarik.resilience.error.RetryPolicy;
import org.tarik.resilience.error.RetryableFailures;

import static java.util.Objects.requireNonNull;
import static org.tarik.resilience.utils.CommonUtils.isBlank;

/**
 * Everything a retrying execution needs to know besides the operation itself.
 *
 * @param policy            Delays and the retry budget.
 * @param retryableFailures Failure kinds which are retried.
 * @param classifier        Maps caught failures to their kinds.
 * @param listener          Optional callback invoked before each retry.
 * @param operationName     Name of the retried operation, used in log messages.
 */
public record RetrySettings(
        RetryPolicy policy,
        RetryableFailures retryableFailures,
        FailureClassifier classifier,
        @Nullable RetryListener listener,
        String operationName) {
    private static final String DEFAULT_OPERATION_NAME = "operation";

    public RetrySettings {
        requireNonNull(policy, "Retry policy must be provided");
        requireNonNull(retryableFailures, "Retryable failures must be provided");
        requireNonNull(classifier, "Failure classifier must be provided");
        operationName = isBlank(operationName) ? DEFAULT_OPERATION_NAME : operationName;
    }

    /**
     * Settings with the given policy and the built-in failure classification. The configuration isn't read.
     */
    public static RetrySettings of(RetryPolicy policy, RetryableFailures retryableFailures) {
        return new RetrySettings(policy, retryableFailures, new DefaultFailureClassifier(), null,
                DEFAULT_OPERATION_NAME);
    }

    /**
     * Settings with the configured default policy and HTTP status codes which retry any exception.
     */
    public static RetrySettings defaults() {
        return new RetrySettings(ResilienceConfig.getDefaultRetryPolicy(), RetryableFailures.any(),
                DefaultFailureClassifier.fromConfig(), null, DEFAULT_OPERATION_NAME);
    }

    public RetrySettings withPolicy(RetryPolicy policy) {
        return new RetrySettings(policy, retryableFailures, classifier, listener, operationName);
    }

    public RetrySettings withRetryableFailures(RetryableFailures retryableFailures) {
        return new RetrySettings(policy, retryableFailures, classifier, listener, operationName);
    }

    public RetrySettings withClassifier(FailureClassifier classifier) {
        return new RetrySettings(policy, retryableFailures, classifier, listener, operationName);
    }

    public RetrySettings withListener(@Nullable RetryListener listener) {
        return new RetrySettings(policy, retryableFailures, classifier, listener, operationName);
    }

    public RetrySettings withOperationName(String operationName) {
        return new RetrySettings(policy, retryableFailures, classifier, listener, operationName);
    }
}
