package org.tarik.resilience.error;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Attempt record of a single retrying execution. Not shared between executions.
 */
public class RetryState {
    private final AtomicInteger attempts = new AtomicInteger(0);
    private final AtomicReference<Throwable> lastFailure = new AtomicReference<>();
    private final AtomicInteger listenerInvocations = new AtomicInteger(0);
    private final AtomicInteger listenerFailures = new AtomicInteger(0);

    public void reset() {
        attempts.set(0);
        lastFailure.set(null);
        listenerInvocations.set(0);
        listenerFailures.set(0);
    }

    public int incrementAttempts() {
        return attempts.incrementAndGet();
    }

    public int getAttempts() {
        return attempts.get();
    }

    public void recordFailure(Throwable failure) {
        lastFailure.set(failure);
    }

    public Optional<Throwable> getLastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    public void recordListenerInvocation(boolean failed) {
        listenerInvocations.incrementAndGet();
        if (failed) {
            listenerFailures.incrementAndGet();
        }
    }

    public int getListenerInvocations() {
        return listenerInvocations.get();
    }

    public int getListenerFailures() {
        return listenerFailures.get();
    }
}
