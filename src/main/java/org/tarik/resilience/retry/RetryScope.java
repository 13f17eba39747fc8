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
import org.tarik.resilience.error.RetryPolicy;
import org.tarik.resilience.error.RetryState;
import org.tarik.resilience.error.RetryableFailures;

import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Caller-driven retries for code which can't be wrapped into a single operation. The caller owns the loop and
 * reports every failure to the scope, which either waits and lets the loop continue, or rethrows the failure:
 * <pre>{@code
 * var scope = new RetryScope(settings);
 * while (scope.hasNextAttempt()) {
 *     scope.enter();
 *     try {
 *         var page = fetchPage();
 *         return parse(page);
 *     } catch (IOException e) {
 *         scope.exit(e);
 *     }
 * }
 * throw (IOException) scope.getLastFailure().orElseThrow();
 * }</pre>
 * A scope keeps its attempt record between loop iterations, so one instance serves one execution at a time.
 * Use {@link #reset()} before reusing it.
 */
public class RetryScope extends AbstractRetrier {
    private final Sleeper sleeper;
    private final RetryState state = new RetryState();

    public RetryScope(RetrySettings settings, Sleeper sleeper) {
        super(settings);
        this.sleeper = requireNonNull(sleeper, "Sleeper must be provided");
    }

    public RetryScope(RetrySettings settings) {
        this(settings, Sleeper.THREAD_SLEEPER);
    }

    public RetryScope(RetryPolicy policy, RetryableFailures retryableFailures) {
        this(RetrySettings.of(policy, retryableFailures));
    }

    public boolean hasNextAttempt() {
        return state.getAttempts() <= settings.policy().maxRetries();
    }

    public RetryScope enter() {
        return this;
    }

    public void exit() {
        // a clean exit leaves the loop through the caller's own return
    }

    /**
     * Reports the failure of the current attempt. Returns normally if the failure is retryable and the retry
     * budget isn't exhausted yet, after having waited for the policy delay. Otherwise rethrows the failure.
     *
     * @param failure the failure raised by the guarded block, {@code null} for a clean exit
     * @throws E the given failure, if it must not be retried
     */
    public <E extends Throwable> void exit(@Nullable E failure) throws E {
        if (failure == null) {
            exit();
            return;
        }
        if (!isRetryable(failure)) {
            onNonRetryable(failure);
            throw failure;
        }
        state.recordFailure(failure);
        int attempt = state.getAttempts();
        if (!hasRetriesLeft(attempt)) {
            onExhausted(failure, attempt);
            throw failure;
        }
        if (Thread.currentThread().isInterrupted()) {
            throw cancellation(failure, null);
        }
        Duration delay = prepareRetry(failure, state);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            throw cancellation(failure, e);
        }
        state.incrementAttempts();
    }

    public int getAttempt() {
        return state.getAttempts();
    }

    public Optional<Throwable> getLastFailure() {
        return state.getLastFailure();
    }

    public int getListenerFailures() {
        return state.getListenerFailures();
    }

    public void reset() {
        state.reset();
    }
}
