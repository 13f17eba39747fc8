package org.tarik.resilience.error;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import static com.google.common.base.Preconditions.checkArgument;
import static java.time.Duration.ofSeconds;
import static java.util.Objects.requireNonNull;

/**
 * Configuration for retry logic.
 * <p>
 * The jitter multiplier is applied after the exponential envelope has been clamped to {@code maxDelay}, so the
 * realized wait may exceed {@code maxDelay} when {@code jitterMax} is above 1.0.
 *
 * @param maxRetries      Number of retries after the first attempt.
 * @param initialDelay    Delay before the first retry.
 * @param maxDelay        Upper bound of the unjittered delay.
 * @param exponentialBase Growth factor of the delay per attempt.
 * @param jitterEnabled   Whether the delay gets multiplied by a random factor.
 * @param jitterMin       Lower bound of the jitter multiplier (inclusive).
 * @param jitterMax       Upper bound of the jitter multiplier.
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        double exponentialBase,
        boolean jitterEnabled,
        double jitterMin,
        double jitterMax) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, ofSeconds(1), ofSeconds(60), 2.0, true, 0.5, 1.5);

    public RetryPolicy {
        requireNonNull(initialDelay, "Initial delay must be provided");
        requireNonNull(maxDelay, "Max delay must be provided");
        checkArgument(maxRetries >= 0, "Max retries must be non-negative, got %s", maxRetries);
        checkArgument(!initialDelay.isNegative() && !initialDelay.isZero(),
                "Initial delay must be positive, got %s", initialDelay);
        checkArgument(maxDelay.compareTo(initialDelay) >= 0,
                "Max delay %s must not be shorter than initial delay %s", maxDelay, initialDelay);
        checkArgument(exponentialBase > 1, "Exponential base must be greater than 1, got %s", exponentialBase);
        checkArgument(jitterMin > 0 && jitterMax > 0, "Jitter range bounds must be positive, got [%s, %s]",
                jitterMin, jitterMax);
        checkArgument(jitterMin <= jitterMax, "Jitter range lower bound %s exceeds upper bound %s", jitterMin,
                jitterMax);
    }

    /**
     * Creates a policy without jitter.
     */
    public RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double exponentialBase) {
        this(maxRetries, initialDelay, maxDelay, exponentialBase, false, 1.0, 1.0);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Calculates the delay to wait before retrying after the given attempt failed.
     *
     * @param attempt zero-based index of the failed attempt
     * @return the delay, jittered if jitter is enabled
     */
    public Duration computeDelay(int attempt) {
        return computeDelay(attempt, ThreadLocalRandom.current());
    }

    public Duration computeDelay(int attempt, Random random) {
        double envelopeNanos = envelopeNanos(attempt);
        if (jitterEnabled) {
            double factor = jitterMin + (jitterMax - jitterMin) * random.nextDouble();
            envelopeNanos = envelopeNanos * factor;
        }
        return Duration.ofNanos(Math.round(envelopeNanos));
    }

    public Duration unjitteredDelay(int attempt) {
        return Duration.ofNanos(Math.round(envelopeNanos(attempt)));
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, exponentialBase, jitterEnabled, jitterMin,
                jitterMax);
    }

    public RetryPolicy withoutJitter() {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, exponentialBase, false, jitterMin, jitterMax);
    }

    private double envelopeNanos(int attempt) {
        checkArgument(attempt >= 0, "Attempt index must be non-negative, got %s", attempt);
        double exponential = initialDelay.toNanos() * Math.pow(exponentialBase, attempt);
        return Math.min(exponential, maxDelay.toNanos());
    }
}
