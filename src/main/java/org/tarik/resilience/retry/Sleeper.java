package org.tarik.resilience.retry;

import org.tarik.resilience.utils.CommonUtils;

import java.time.Duration;

/**
 * Blocks the calling thread between two attempts.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD_SLEEPER = CommonUtils::sleep;

    void sleep(Duration duration) throws InterruptedException;
}
