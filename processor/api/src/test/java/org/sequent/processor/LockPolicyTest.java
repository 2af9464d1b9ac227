/*
 * Copyright 2023 Johan Haleby
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

package org.sequent.processor;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.sequent.retry.RetryStrategy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class LockPolicyTest {

    @Test
    void fail_throws_lock_acquisition_failed_exception_when_lock_is_taken() {
        // When
        Throwable throwable = catchThrowable(() -> LockPolicy.fail().acquire(new CountingLock(Integer.MAX_VALUE), "processor"));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(LockAcquisitionFailedException.class).hasMessage("Failed to acquire lock for processor 'processor'"),
                () -> assertThat(((LockAcquisitionFailedException) throwable).processorId).isEqualTo("processor")
        );
    }

    @Test
    void skip_returns_false_when_lock_is_taken() {
        assertThat(LockPolicy.skip().acquire(new CountingLock(Integer.MAX_VALUE), "processor")).isFalse();
    }

    @Test
    void retry_acquires_lock_when_it_becomes_available() {
        // Given
        CountingLock lock = new CountingLock(2);

        // When
        boolean acquired = LockPolicy.retry(RetryStrategy.fixed(Duration.ofMillis(10)).maxAttempts(5)).acquire(lock, "processor");

        // Then
        assertAll(
                () -> assertThat(acquired).isTrue(),
                () -> assertThat(lock.attempts.get()).isEqualTo(3)
        );
    }

    @Test
    void retry_gives_up_when_attempts_are_exhausted() {
        // Given
        CountingLock lock = new CountingLock(Integer.MAX_VALUE);

        // When
        boolean acquired = LockPolicy.retry(RetryStrategy.fixed(Duration.ofMillis(10)).maxAttempts(3)).acquire(lock, "processor");

        // Then
        assertAll(
                () -> assertThat(acquired).isFalse(),
                () -> assertThat(lock.attempts.get()).isEqualTo(3)
        );
    }

    private static class CountingLock implements ProcessorLock {
        private final int failuresBeforeSuccess;
        private final AtomicInteger attempts = new AtomicInteger();

        private CountingLock(int failuresBeforeSuccess) {
            this.failuresBeforeSuccess = failuresBeforeSuccess;
        }

        @Override
        public boolean tryAcquire() {
            return attempts.incrementAndGet() > failuresBeforeSuccess;
        }

        @Override
        public void release() {
        }
    }
}
