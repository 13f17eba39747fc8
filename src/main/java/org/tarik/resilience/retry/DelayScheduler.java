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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Provides non-blocking pauses between two attempts of an asynchronous operation.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * Returns a future which completes once the delay has elapsed. Cancelling the future cancels the pause.
     */
    CompletableFuture<Void> delay(Duration delay);

    static DelayScheduler using(ScheduledExecutorService scheduler) {
        return delay -> {
            var pause = new CompletableFuture<Void>();
            var scheduledCompletion = scheduler.schedule(() -> pause.complete(null), delay.toNanos(), NANOSECONDS);
            pause.whenComplete((ignored, error) -> {
                if (pause.isCancelled()) {
                    scheduledCompletion.cancel(false);
                }
            });
            return pause;
        };
    }

    /**
     * The process-wide scheduler backed by daemon threads.
     */
    static DelayScheduler shared() {
        return SharedDelayScheduler.INSTANCE;
    }
}
