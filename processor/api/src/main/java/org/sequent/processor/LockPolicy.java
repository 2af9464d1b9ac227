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

import org.sequent.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * What to do when a processor lock cannot be acquired.
 */
public sealed interface LockPolicy {

    /**
     * Throw {@link LockAcquisitionFailedException}
     */
    static LockPolicy fail() {
        return Fail.INSTANCE;
    }

    /**
     * Leave the processor idle
     */
    static LockPolicy skip() {
        return Skip.INSTANCE;
    }

    /**
     * Retry according to the {@code retryStrategy} and leave the processor idle if the lock still cannot be acquired
     */
    static LockPolicy retry(RetryStrategy retryStrategy) {
        return new Retry(retryStrategy);
    }

    /**
     * @return {@code true} if the lock was acquired
     * @throws LockAcquisitionFailedException If the lock wasn't acquired and the policy is {@link Fail}
     */
    boolean acquire(ProcessorLock lock, String processorId);

    final class Fail implements LockPolicy {
        private static final Fail INSTANCE = new Fail();

        private Fail() {
        }

        @Override
        public boolean acquire(ProcessorLock lock, String processorId) {
            if (!lock.tryAcquire()) {
                throw new LockAcquisitionFailedException(processorId);
            }
            return true;
        }

        @Override
        public String toString() {
            return "FAIL";
        }
    }

    final class Skip implements LockPolicy {
        private static final Skip INSTANCE = new Skip();

        private Skip() {
        }

        @Override
        public boolean acquire(ProcessorLock lock, String processorId) {
            return lock.tryAcquire();
        }

        @Override
        public String toString() {
            return "SKIP";
        }
    }

    record Retry(RetryStrategy retryStrategy) implements LockPolicy {
        private static final Logger log = LoggerFactory.getLogger(LockPolicy.class);

        public Retry {
            requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        }

        @Override
        public boolean acquire(ProcessorLock lock, String processorId) {
            try {
                return retryStrategy.execute(() -> {
                    if (!lock.tryAcquire()) {
                        throw new LockAcquisitionFailedException(processorId);
                    }
                    return true;
                });
            } catch (LockAcquisitionFailedException e) {
                log.info("Giving up acquiring lock for processor '{}'", processorId);
                return false;
            }
        }
    }
}
