/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sequent.retry.internal;

import org.jspecify.annotations.NonNull;
import org.sequent.retry.Backoff;
import org.sequent.retry.MaxAttempts;
import org.sequent.retry.RetryStrategy;
import org.sequent.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    public static Runnable executeWithRetry(@NonNull Runnable runnable, @NonNull Predicate<Throwable> shutdownPredicate, @NonNull RetryStrategy retryStrategy) {
        Supplier<Void> supplier = executeWithRetry(() -> {
            runnable.run();
            return null;
        }, shutdownPredicate, retryStrategy);
        return supplier::get;
    }

    /**
     * @param shutdownPredicate Retrying stops as soon as this predicate returns {@code false} for the thrown exception, typically
     *                          because the component executing the supplier is shutting down.
     */
    public static <T> Supplier<T> executeWithRetry(@NonNull Supplier<T> supplier, @NonNull Predicate<Throwable> shutdownPredicate, @NonNull RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return supplier;
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        Predicate<Throwable> retryPredicate = shutdownPredicate.and(retry.retryPredicate);
        return () -> executeWithRetry(supplier, retry, retryPredicate, convertToDelayStream(retry.backoff));
    }

    private static <T> T executeWithRetry(Supplier<T> supplier, RetryImpl retry, Predicate<Throwable> retryPredicate, Iterator<Long> delay) {
        int attempt = 1;
        for (; ; ) {
            try {
                return supplier.get();
            } catch (Throwable e) {
                Duration backoff = Duration.ofMillis(delay.next());
                boolean retryable = !isExhausted(attempt, retry.maxAttempts) && retryPredicate.test(e);
                retry.errorListener.accept(new ErrorInfoImpl(attempt, retryable ? backoff : null, retryable), e);
                if (!retryable) {
                    return SafeExceptionRethrower.safeRethrow(e);
                }

                long backoffMillis = backoff.toMillis();
                if (backoffMillis > 0) {
                    try {
                        TimeUnit.MILLISECONDS.sleep(backoffMillis);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RuntimeException(e);
                    }
                }
                attempt++;
            }
        }
    }

    private static boolean isExhausted(int attempt, MaxAttempts maxAttempts) {
        if (maxAttempts instanceof MaxAttempts.Infinite) {
            return false;
        }
        return attempt >= ((MaxAttempts.Limit) maxAttempts).limit();
    }

    private static Iterator<Long> convertToDelayStream(Backoff backoff) {
        final Stream<Long> delay;
        if (backoff instanceof Backoff.None) {
            delay = Stream.iterate(0L, __ -> 0L);
        } else if (backoff instanceof Backoff.Fixed fixed) {
            long millis = fixed.millis;
            delay = Stream.iterate(millis, __ -> millis);
        } else if (backoff instanceof Backoff.Exponential strategy) {
            long initialMillis = strategy.initial.toMillis();
            long maxMillis = strategy.max.toMillis();
            double multiplier = strategy.multiplier;
            delay = Stream.iterate(initialMillis, current -> Math.min(maxMillis, Math.round(current * multiplier)));
        } else {
            throw new IllegalStateException("Invalid backoff: " + backoff.getClass().getName());
        }
        return delay.iterator();
    }
}
