package org.tarik.resilience.retry;

/**
 * Callback notified before each retry. Exceptions thrown by the callback are logged and discarded, they never
 * affect the retried operation.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param failure the failure which caused the retry
     * @param attempt zero-based index of the failed attempt
     */
    void onRetry(Throwable failure, int attempt) throws Exception;
}
