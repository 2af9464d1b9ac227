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

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configures how processor locks are acquired and how long they are valid without being refreshed.
 */
public class ProcessorLockConfig {
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(300);

    public final Duration lockTimeout;
    public final LockPolicy lockPolicy;

    /**
     * @param lockTimeout A lock that hasn't been refreshed within this duration may be taken over by another instance.
     *                    Locks are refreshed at half this interval while the processor is running.
     * @param lockPolicy  What to do when the lock cannot be acquired on start
     */
    public ProcessorLockConfig(Duration lockTimeout, LockPolicy lockPolicy) {
        requireNonNull(lockTimeout, "lockTimeout cannot be null");
        requireNonNull(lockPolicy, LockPolicy.class.getSimpleName() + " cannot be null");
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be greater than zero");
        }
        this.lockTimeout = lockTimeout;
        this.lockPolicy = lockPolicy;
    }

    /**
     * @return A config with a lock timeout of 300 seconds that leaves the processor idle if the lock is held by another instance
     */
    public static ProcessorLockConfig defaultConfig() {
        return new ProcessorLockConfig(DEFAULT_LOCK_TIMEOUT, LockPolicy.skip());
    }

    public ProcessorLockConfig lockTimeout(Duration lockTimeout) {
        return new ProcessorLockConfig(lockTimeout, lockPolicy);
    }

    public ProcessorLockConfig lockPolicy(LockPolicy lockPolicy) {
        return new ProcessorLockConfig(lockTimeout, lockPolicy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessorLockConfig)) return false;
        ProcessorLockConfig that = (ProcessorLockConfig) o;
        return Objects.equals(lockTimeout, that.lockTimeout) && Objects.equals(lockPolicy, that.lockPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lockTimeout, lockPolicy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ProcessorLockConfig.class.getSimpleName() + "[", "]")
                .add("lockTimeout=" + lockTimeout)
                .add("lockPolicy=" + lockPolicy)
                .toString();
    }
}
