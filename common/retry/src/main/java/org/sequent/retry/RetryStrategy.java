/*
 * Copyright 2021 Johan Haleby
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

package org.sequent.retry;

import org.sequent.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.*;

import static org.sequent.retry.internal.RetryExecution.executeWithRetry;

/**
 * Decides whether, and how long to wait before, an action that failed is invoked again. Used when acquiring processor
 * locks, when polling for new messages and when resubscribing to a change stream.
 * <p>
 * Instances are immutable. Every configuration method returns a new instance so that a shared base strategy can be
 * specialized per call site:
 * <pre>
 * RetryStrategy.Retry base = RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0);
 * base.maxAttempts(10).execute(() -> lock.tryAcquire());
 * base.retryIf(e -> e instanceof TransientDataAccessException).execute(() -> poll());
 * </pre>
 * When the strategy is exhausted, the last exception thrown by the action is rethrown as is.
 */
public interface RetryStrategy {

    /**
     * @return A strategy that retries forever, without delay, on any exception. Configure it further with the methods of {@link Retry}.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * @return A strategy that invokes the action once and rethrows its exception
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * The delay starts at {@code initial} and is multiplied by {@code multiplier} after each failed attempt, up to {@code max}.
     */
    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * Wait {@code delay} between attempts.
     */
    static Retry fixed(Duration delay) {
        return retry().backoff(Backoff.fixed(delay));
    }

    /**
     * Invoke {@code supplier} until it returns or the strategy gives up.
     *
     * @return The value returned by the first successful invocation
     */
    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(supplier, __ -> true, this).get();
    }

    /**
     * Invoke {@code runnable} until it completes normally or the strategy gives up.
     */
    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(runnable, __ -> true, this).run();
    }

    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    /**
     * A strategy that retries. Unless configured otherwise it retries every exception an unlimited number of times.
     */
    interface Retry extends RetryStrategy {

        Retry backoff(Backoff backoff);

        Retry infiniteAttempts();

        /**
         * @param maxAttempts The total number of invocations, including the first one
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Replace the predicate that decides if an exception is retried.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Derive a new predicate from the current one, for example {@code predicate -> predicate.and(MyClass::isTransient)},
         * which keeps what the caller configured and narrows it further.
         */
        Retry mapRetryPredicate(Function<Predicate<Throwable>, Predicate<Throwable>> retryPredicateFn);

        /**
         * Register a listener that is notified of every exception thrown by the action, retried or not. Listeners are
         * added to the ones already registered.
         */
        Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener);

        Retry onError(Consumer<Throwable> errorListener);
    }
}
