package org.tarik.resilience.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tarik.resilience.error.RetryPolicy;
import org.tarik.resilience.error.RetryableFailures;
import org.tarik.resilience.exceptions.PlatformException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static java.time.Duration.ofMillis;
import static java.time.Duration.ofSeconds;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.tarik.resilience.error.FailureKind.*;

@ExtendWith(MockitoExtension.class)
class AsyncRetryExecutorTest {
    private static final RetryPolicy POLICY = new RetryPolicy(3, ofSeconds(1), ofSeconds(60), 2.0);

    private final List<Duration> delays = new ArrayList<>();
    private final DelayScheduler immediateScheduler = delay -> {
        delays.add(delay);
        return completedFuture(null);
    };
    private ScheduledExecutorService scheduledExecutor;
    private ExecutorService attemptExecutor;

    @Mock
    private RetryListener listener;

    @AfterEach
    void tearDown() {
        if (scheduledExecutor != null) {
            scheduledExecutor.shutdownNow();
        }
        if (attemptExecutor != null) {
            attemptExecutor.shutdownNow();
        }
    }

    private AsyncRetryExecutor executor(RetryableFailures retryableFailures, DelayScheduler scheduler) {
        return new AsyncRetryExecutor(RetrySettings.of(POLICY, retryableFailures).withListener(listener)
                .withOperationName("summarize news"), scheduler);
    }

    @Test
    @DisplayName("Should complete with the value of the first successful attempt")
    void shouldSucceedOnFirstAttempt() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();

        // When
        var result = executor(RetryableFailures.any(), immediateScheduler).execute(() -> {
            invocations.incrementAndGet();
            return completedFuture("summary");
        });

        // Then
        assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("summary");
        assertThat(invocations).hasValue(1);
        assertThat(delays).isEmpty();
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Should retry three times and succeed on the fourth attempt")
    void shouldRetryAndSucceed() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        Supplier<CompletionStage<String>> operation = () -> invocations.incrementAndGet() <= 3
                ? failedFuture(new PlatformException("Empty response", MODEL_RESPONSE))
                : completedFuture("summary");

        // When
        var result = executor(RetryableFailures.of(MODEL), immediateScheduler).execute(operation);

        // Then
        assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("summary");
        assertThat(invocations).hasValue(4);
        assertThat(delays).containsExactly(ofSeconds(1), ofSeconds(2), ofSeconds(4));
        verify(listener).onRetry(any(PlatformException.class), eq(0));
        verify(listener).onRetry(any(PlatformException.class), eq(1));
        verify(listener).onRetry(any(PlatformException.class), eq(2));
        verifyNoMoreInteractions(listener);
    }

    @Test
    @DisplayName("Should fail with the last failure after max retries")
    void shouldFailAfterMaxRetries() {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        List<PlatformException> failures = new ArrayList<>();
        Supplier<CompletionStage<String>> operation = () -> {
            var failure = new PlatformException("Timeout " + invocations.incrementAndGet(), API_TIMEOUT);
            failures.add(failure);
            return failedFuture(failure);
        };

        // When
        var result = executor(RetryableFailures.of(API), immediateScheduler).execute(operation);

        // Then
        assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isSameAs(failures.get(3));
        assertThat(invocations).hasValue(4);
        assertThat(delays).hasSize(3);
    }

    @Test
    @DisplayName("Should not retry a non-retryable failure")
    void shouldNotRetryNonRetryableFailure() {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        var failure = new PlatformException("Cannot parse factor", FACTOR_PARSE);

        // When
        var result = executor(RetryableFailures.of(API), immediateScheduler).<String>execute(() -> {
            invocations.incrementAndGet();
            return failedFuture(failure);
        });

        // Then
        assertThatThrownBy(result::join).hasCause(failure);
        assertThat(invocations).hasValue(1);
        assertThat(delays).isEmpty();
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Should treat a failure thrown by the supplier like a failed stage")
    void shouldRetrySynchronousFailureOfSupplier() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        Supplier<CompletionStage<String>> operation = () -> {
            if (invocations.incrementAndGet() == 1) {
                throw new PlatformException("Crawler offline", DATA_FETCH);
            }
            return completedFuture("news");
        };

        // When
        var result = executor(RetryableFailures.transientFailures(), immediateScheduler).execute(operation);

        // Then
        assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("news");
        assertThat(invocations).hasValue(2);
    }

    @Test
    @DisplayName("Should unwrap completion exceptions before classifying the failure")
    void shouldUnwrapCompletionException() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        Supplier<CompletionStage<String>> operation = () -> invocations.incrementAndGet() == 1
                ? CompletableFuture.supplyAsync(() -> {
                    throw new PlatformException("Rate limited", API_RATE_LIMIT);
                })
                : completedFuture("ok");

        // When
        var result = executor(RetryableFailures.of(API_RATE_LIMIT), immediateScheduler).execute(operation);

        // Then
        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(invocations).hasValue(2);
    }

    @Test
    @DisplayName("Should ignore failures of the retry listener")
    void shouldIgnoreListenerFailure() throws Exception {
        // Given
        doThrow(new IllegalStateException("listener broken")).when(listener).onRetry(any(), anyInt());
        AtomicInteger invocations = new AtomicInteger();

        // When
        var result = executor(RetryableFailures.any(), immediateScheduler).<String>execute(() ->
                invocations.incrementAndGet() == 1 ? failedFuture(new IllegalStateException("flaky"))
                        : completedFuture("done"));

        // Then
        assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("done");
        verify(listener).onRetry(any(IllegalStateException.class), eq(0));
    }

    @Test
    @DisplayName("Cancelling the result should cancel the pending pause and stop retrying")
    void shouldStopRetryingWhenCancelledDuringPause() {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        CompletableFuture<Void> pause = new CompletableFuture<>();
        DelayScheduler pendingScheduler = delay -> pause;
        var executor = executor(RetryableFailures.any(), pendingScheduler);

        // When
        var result = executor.<String>execute(() -> {
            invocations.incrementAndGet();
            return failedFuture(new PlatformException("Timed out", API_TIMEOUT));
        });
        result.cancel(true);

        // Then
        assertThat(result).isCancelled();
        assertThat(pause).isCancelled();
        assertThat(invocations).hasValue(1);
    }

    @Test
    @DisplayName("Cancelling the result should cancel the in-flight attempt without notifying the listener")
    void shouldCancelInFlightAttempt() {
        // Given
        CompletableFuture<String> inFlight = new CompletableFuture<>();
        var executor = executor(RetryableFailures.any(), immediateScheduler);

        // When
        var result = executor.execute(() -> inFlight);
        result.cancel(true);

        // Then
        assertThat(inFlight).isCancelled();
        assertThat(delays).isEmpty();
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Should propagate cancellation of the operation instead of retrying it")
    void shouldNotRetryCancelledOperation() {
        // Given
        AtomicInteger invocations = new AtomicInteger();

        // When
        var result = executor(RetryableFailures.any(), immediateScheduler).<String>execute(() -> {
            invocations.incrementAndGet();
            return failedFuture(new CancellationException("deadline reached"));
        });

        // Then
        assertThat(result).isCancelled();
        assertThat(invocations).hasValue(1);
        assertThat(delays).isEmpty();
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Should keep the original failure when the next attempt can't be scheduled")
    void shouldFailWhenSchedulingFails() {
        // Given
        var failure = new PlatformException("Timed out", API_TIMEOUT);
        DelayScheduler brokenScheduler = delay -> {
            throw new IllegalStateException("scheduler shut down");
        };

        // When
        var result = executor(RetryableFailures.any(), brokenScheduler).<String>execute(() -> failedFuture(failure));

        // Then
        assertThatThrownBy(result::join).hasCause(failure);
        assertThat(failure.getSuppressed()).hasSize(1);
    }

    @Test
    @DisplayName("Waiting tasks should not block other tasks of the same scheduler thread")
    void shouldNotBlockSchedulerWhileWaiting() throws Exception {
        // Given
        scheduledExecutor = Executors.newSingleThreadScheduledExecutor();
        var policy = new RetryPolicy(2, ofMillis(200), ofMillis(200), 2.0);
        var executor = new AsyncRetryExecutor(RetrySettings.of(policy, RetryableFailures.any()),
                DelayScheduler.using(scheduledExecutor));
        AtomicInteger slowInvocations = new AtomicInteger();
        AtomicInteger fastInvocations = new AtomicInteger();

        // When
        var slow = executor.execute(() -> slowInvocations.incrementAndGet() < 3
                ? failedFuture(new IllegalStateException("busy"))
                : completedFuture("slow"));
        var fast = executor.execute(() -> fastInvocations.incrementAndGet() < 2
                ? failedFuture(new IllegalStateException("busy"))
                : completedFuture("fast"));

        // Then
        assertThat(fast.get(5, TimeUnit.SECONDS)).isEqualTo("fast");
        assertThat(slow.isDone()).isFalse();
        assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
        assertThat(slowInvocations).hasValue(3);
        assertThat(fastInvocations).hasValue(2);
    }

    @Test
    @DisplayName("Retried attempts should run on the attempt executor instead of the scheduler thread")
    void shouldRunRetriedAttemptsOutsideSchedulerThread() throws Exception {
        // Given
        scheduledExecutor = Executors.newSingleThreadScheduledExecutor(task -> new Thread(task, "timer"));
        attemptExecutor = Executors.newSingleThreadExecutor(task -> new Thread(task, "attempts"));
        var policy = new RetryPolicy(1, ofMillis(10), ofMillis(10), 2.0);
        var executor = new AsyncRetryExecutor(RetrySettings.of(policy, RetryableFailures.any()),
                DelayScheduler.using(scheduledExecutor), attemptExecutor);
        List<String> attemptThreads = new ArrayList<>();

        // When
        var result = executor.execute(() -> {
            attemptThreads.add(Thread.currentThread().getName());
            return attemptThreads.size() == 1 ? failedFuture(new IllegalStateException("busy"))
                    : completedFuture("done");
        });

        // Then
        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("done");
        assertThat(attemptThreads).hasSize(2);
        assertThat(attemptThreads.get(0)).isEqualTo(Thread.currentThread().getName());
        assertThat(attemptThreads.get(1)).isEqualTo("attempts");
    }

    @Test
    @DisplayName("A slow retried attempt should not delay the retries of other executions")
    void shouldNotDelayOtherRetriesWhileAttemptIsBusy() throws Exception {
        // Given
        scheduledExecutor = Executors.newSingleThreadScheduledExecutor(task -> new Thread(task, "timer"));
        attemptExecutor = Executors.newCachedThreadPool();
        var slowExecutor = new AsyncRetryExecutor(
                RetrySettings.of(new RetryPolicy(1, ofMillis(50), ofMillis(50), 2.0), RetryableFailures.any()),
                DelayScheduler.using(scheduledExecutor), attemptExecutor);
        var fastExecutor = new AsyncRetryExecutor(
                RetrySettings.of(new RetryPolicy(1, ofMillis(100), ofMillis(100), 2.0), RetryableFailures.any()),
                DelayScheduler.using(scheduledExecutor), attemptExecutor);
        CompletableFuture<Void> slowAttemptRelease = new CompletableFuture<>();
        AtomicInteger slowInvocations = new AtomicInteger();
        AtomicInteger fastInvocations = new AtomicInteger();

        // When
        var slow = slowExecutor.execute(() -> {
            if (slowInvocations.incrementAndGet() == 1) {
                return failedFuture(new IllegalStateException("busy"));
            }
            slowAttemptRelease.join();
            return completedFuture("slow");
        });
        var fast = fastExecutor.execute(() -> fastInvocations.incrementAndGet() == 1
                ? failedFuture(new IllegalStateException("busy"))
                : completedFuture("fast"));

        // Then
        try {
            assertThat(fast.get(5, TimeUnit.SECONDS)).isEqualTo("fast");
            assertThat(slow.isDone()).isFalse();
        } finally {
            slowAttemptRelease.complete(null);
        }
        assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
    }

    @Test
    @DisplayName("Should keep the original failure when the attempt executor rejects the next attempt")
    void shouldFailWhenAttemptExecutorRejects() {
        // Given
        var failure = new PlatformException("Timed out", API_TIMEOUT);
        var executor = new AsyncRetryExecutor(RetrySettings.of(POLICY, RetryableFailures.any()), immediateScheduler,
                task -> {
                    throw new RejectedExecutionException("pool shut down");
                });

        // When
        var result = executor.<String>execute(() -> failedFuture(failure));

        // Then
        assertThatThrownBy(result::join).hasCause(failure);
        assertThat(failure.getSuppressed()).singleElement().isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    @DisplayName("Decorated supplier should start a new execution per call")
    void shouldDecorateSupplier() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        var executor = executor(RetryableFailures.any(), immediateScheduler);

        // When
        var decorated = executor.decorateSupplier(() -> invocations.incrementAndGet() % 2 == 1
                ? failedFuture(new IllegalStateException("flaky"))
                : completedFuture(invocations.get()));

        // Then
        assertThat(invocations).hasValue(0);
        assertThat(decorated.get().get(1, TimeUnit.SECONDS)).isEqualTo(2);
        assertThat(decorated.get().get(1, TimeUnit.SECONDS)).isEqualTo(4);
    }
}
