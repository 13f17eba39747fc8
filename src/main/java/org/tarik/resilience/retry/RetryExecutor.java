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

import org.tarik.resilience.error.RetryPolicy;
import org.tarik.resilience.error.RetryState;
import org.tarik.resilience.error.RetryableFailures;

import java.lang.reflect.UndeclaredThrowableException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Runs blocking operations with retries. The calling thread sleeps between attempts, so this executor must not
 * be used on threads of a shared scheduler; use {@link AsyncRetryExecutor} there.
 * <p>
 * Failures are always propagated as they were thrown by the operation. An interruption of the calling thread
 * stops retrying with a {@link java.util.concurrent.CancellationException}.
 */
public class RetryExecutor extends AbstractRetrier {
    private final Sleeper sleeper;

    public RetryExecutor(RetrySettings settings, Sleeper sleeper) {
        super(settings);
        this.sleeper = requireNonNull(sleeper, "Sleeper must be provided");
    }

    public RetryExecutor(RetrySettings settings) {
        this(settings, Sleeper.THREAD_SLEEPER);
    }

    public RetryExecutor(RetryPolicy policy, RetryableFailures retryableFailures) {
        this(RetrySettings.of(policy, retryableFailures));
    }

    public <T> T call(Callable<T> operation) throws Exception {
        requireNonNull(operation, "Operation must be provided");
        var state = new RetryState();
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                handleFailure(e, state);
            }
        }
    }

    public <T> T get(Supplier<T> operation) {
        requireNonNull(operation, "Operation must be provided");
        try {
            return call(operation::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new UndeclaredThrowableException(e);
        }
    }

    public void run(Runnable operation) {
        requireNonNull(operation, "Operation must be provided");
        get(() -> {
            operation.run();
            return null;
        });
    }

    public <T> Callable<T> decorateCallable(Callable<T> operation) {
        return () -> call(operation);
    }

    public <T> Supplier<T> decorateSupplier(Supplier<T> operation) {
        return () -> get(operation);
    }

    public Runnable decorateRunnable(Runnable operation) {
        return () -> run(operation);
    }

    public <I, O> Function<I, O> decorateFunction(Function<I, O> function) {
        return input -> get(() -> function.apply(input));
    }

    private void handleFailure(Exception failure, RetryState state) throws Exception {
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
}
