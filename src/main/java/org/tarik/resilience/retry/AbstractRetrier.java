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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.resilience.error.RetryPolicy;
import org.tarik.resilience.error.RetryState;

import java.time.Duration;
import java.util.concurrent.CancellationException;

import static java.util.Objects.requireNonNull;
import static org.tarik.resilience.utils.CommonUtils.toCancellation;

/**
 * Retry decisions shared by all the ways of running an operation with retries: classification of the failure,
 * budget checks, delay calculation, logging and notification of the listener.
 */
public abstract class AbstractRetrier {
    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final RetrySettings settings;

    protected AbstractRetrier(RetrySettings settings) {
        this.settings = requireNonNull(settings, "Retry settings must be provided");
    }

    public RetrySettings getSettings() {
        return settings;
    }

    protected boolean isRetryable(Throwable failure) {
        return settings.retryableFailures().isRetryable(failure, settings.classifier());
    }

    protected boolean hasRetriesLeft(int attempt) {
        return attempt < settings.policy().maxRetries();
    }

    protected void onNonRetryable(Throwable failure) {
        log.debug("'{}' failed with a non-retryable error: {}", settings.operationName(), failure.toString());
    }

    protected void onExhausted(Throwable failure, int attempt) {
        log.error("'{}' failed after {} retries. Last error: {}", settings.operationName(), attempt,
                failure.getMessage(), failure);
    }

    /**
     * Logs the upcoming retry, notifies the listener and returns the delay to wait before the next attempt.
     */
    protected Duration prepareRetry(Throwable failure, RetryState state) {
        RetryPolicy policy = settings.policy();
        int attempt = state.getAttempts();
        Duration delay = policy.computeDelay(attempt);
        log.warn("Attempt {}/{} of '{}' failed: {}. Retrying in {}ms...", attempt + 1, policy.maxAttempts(),
                settings.operationName(), failure.toString(), delay.toMillis());
        notifyListener(failure, attempt, state);
        return delay;
    }

    protected CancellationException cancellation(Throwable failure, @Nullable InterruptedException interruption) {
        var message = "Retrying of '%s' was cancelled".formatted(settings.operationName());
        var cancellation = interruption == null ? new CancellationException(message)
                : toCancellation(interruption, message);
        cancellation.addSuppressed(failure);
        return cancellation;
    }

    private void notifyListener(Throwable failure, int attempt, RetryState state) {
        RetryListener listener = settings.listener();
        if (listener == null) {
            return;
        }
        try {
            listener.onRetry(failure, attempt);
            state.recordListenerInvocation(false);
        } catch (Exception e) {
            state.recordListenerInvocation(true);
            log.error("Retry listener of '{}' failed on attempt {}", settings.operationName(), attempt, e);
        }
    }
}
