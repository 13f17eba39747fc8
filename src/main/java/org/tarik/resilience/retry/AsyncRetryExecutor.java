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

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.tarik.resilience.error.RetryableFailures.isCancellation;

/**
 * Runs asynchronous operations with retries. Between two attempts no thread is blocked: the next attempt is
 * triggered by a {@link DelayScheduler} once the delay has elapsed, so that other tasks keep running meanwhile.
 * The scheduler only completes the pause: retried attempts run on the attempt executor, the common
 * {@link ForkJoinPool} unless another one is given.
 * <p>
 * The returned future fails with the failure of the last attempt as it was produced by the operation. Cancelling
 * the returned future stops retrying: the pending pause and the in-flight attempt are cancelled and the listener
 * is not notified anymore.
 */
public class AsyncRetryExecutor extends AbstractRetrier {
    private final DelayScheduler delayScheduler;
    private final Executor attemptExecutor;

    public AsyncRetryExecutor(RetrySettings settings, DelayScheduler delayScheduler, Executor attemptExecutor) {
        super(settings);
        this.delayScheduler = requireNonNull(delayScheduler, "Delay scheduler must be provided");
        this.attemptExecutor = requireNonNull(attemptExecutor, "Attempt executor must be provided");
    }

    public AsyncRetryExecutor(RetrySettings settings, DelayScheduler delayScheduler) {
        this(settings, delayScheduler, ForkJoinPool.commonPool());
    }

    public AsyncRetryExecutor(RetrySettings settings) {
        this(settings, DelayScheduler.shared());
    }

    public AsyncRetryExecutor(RetryPolicy policy, RetryableFailures retryableFailures) {
        this(RetrySettings.of(policy, retryableFailures));
    }

    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation) {
        requireNonNull(operation, "Operation must be provided");
        var result = new CompletableFuture<T>();
        runAttempt(operation, result, new RetryState());
        return result;
    }

    public <T> Supplier<CompletableFuture<T>> decorateSupplier(Supplier<? extends CompletionStage<T>> operation) {
        return () -> execute(operation);
    }

    public <I, O> Function<I, CompletableFuture<O>> decorateFunction(
            Function<I, ? extends CompletionStage<O>> function) {
        return input -> execute(() -> function.apply(input));
    }

    private <T> void runAttempt(Supplier<? extends CompletionStage<T>> operation, CompletableFuture<T> result,
            RetryState state) {
        if (result.isDone()) {
            return;
        }
        CompletionStage<T> stage;
        try {
            stage = requireNonNull(operation.get(), "Operation returned no completion stage");
        } catch (Throwable e) {
            onFailure(e, operation, result, state);
            return;
        }
        if (stage instanceof Future<?> inFlight) {
            result.whenComplete((value, error) -> {
                if (result.isCancelled()) {
                    inFlight.cancel(true);
                }
            });
        }
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                onFailure(unwrap(error), operation, result, state);
            }
        });
    }

    private <T> void onFailure(Throwable failure, Supplier<? extends CompletionStage<T>> operation,
            CompletableFuture<T> result, RetryState state) {
        if (result.isDone()) {
            return;
        }
        if (isCancellation(failure)) {
            result.completeExceptionally(toCancellation(failure));
            return;
        }
        if (!isRetryable(failure)) {
            onNonRetryable(failure);
            result.completeExceptionally(failure);
            return;
        }
        state.recordFailure(failure);
        int attempt = state.getAttempts();
        if (!hasRetriesLeft(attempt)) {
            onExhausted(failure, attempt);
            result.completeExceptionally(failure);
            return;
        }

        Duration delay = prepareRetry(failure, state);
        CompletableFuture<Void> pause;
        try {
            pause = delayScheduler.delay(delay);
        } catch (RuntimeException e) {
            log.error("Couldn't schedule the next attempt of '{}'", settings.operationName(), e);
            failure.addSuppressed(e);
            result.completeExceptionally(failure);
            return;
        }
        result.whenComplete((value, error) -> pause.cancel(false));
        pause.whenCompleteAsync((ignored, pauseError) -> {
            if (pauseError == null) {
                state.incrementAttempts();
                runAttempt(operation, result, state);
            } else if (!result.isDone()) {
                var cause = unwrap(pauseError);
                if (isCancellation(cause)) {
                    result.completeExceptionally(cancellation(failure, null));
                } else {
                    failure.addSuppressed(cause);
                    result.completeExceptionally(failure);
                }
            }
        }, attemptExecutor).whenComplete((ignored, dispatchError) -> {
            if (dispatchError != null && !result.isDone()) {
                log.error("Couldn't start the next attempt of '{}'", settings.operationName(), dispatchError);
                failure.addSuppressed(unwrap(dispatchError));
                result.completeExceptionally(failure);
            }
        });
    }

    private CancellationException toCancellation(Throwable failure) {
        if (failure instanceof CancellationException cancellation) {
            return cancellation;
        }
        var cancellation = new CancellationException(
                "'%s' was interrupted".formatted(settings.operationName()));
        cancellation.initCause(failure);
        return cancellation;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
