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

package org.sequent.processor.inmemory;

import org.sequent.processor.LockMode;
import org.sequent.processor.ProcessorDefinition;
import org.sequent.processor.ProcessorLock;
import org.sequent.processor.ProcessorLockFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Creates locks that are coordinated in memory. Locks created by the same factory exclude each other, which makes it
 * possible to simulate several consumer instances in one JVM. An exclusive lock that hasn't been refreshed within the lock
 * timeout can be taken over by another instance.
 */
public class InMemoryProcessorLockFactory implements ProcessorLockFactory {
    private final Duration lockTimeout;
    private final Clock clock;
    private final Map<String, LockState> locks = new HashMap<>();

    public InMemoryProcessorLockFactory() {
        this(Duration.ofMinutes(5));
    }

    public InMemoryProcessorLockFactory(Duration lockTimeout) {
        this(lockTimeout, Clock.systemUTC());
    }

    public InMemoryProcessorLockFactory(Duration lockTimeout, Clock clock) {
        this.lockTimeout = requireNonNull(lockTimeout, "lockTimeout cannot be null");
        this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    @Override
    public ProcessorLock create(ProcessorDefinition definition, String instanceId, LockMode lockMode) {
        String lockKey = definition.partition() + ":" + definition.lockName() + ":" + definition.version();
        return new InMemoryProcessorLock(lockKey, instanceId, lockMode);
    }

    /**
     * @return The instance id that holds the exclusive lock of {@code definition}, if any
     */
    public synchronized Optional<String> exclusiveOwner(ProcessorDefinition definition) {
        LockState state = locks.get(definition.partition() + ":" + definition.lockName() + ":" + definition.version());
        return Optional.ofNullable(state == null ? null : state.exclusiveOwner);
    }

    private synchronized boolean tryAcquire(String lockKey, String instanceId, LockMode lockMode) {
        LockState state = locks.computeIfAbsent(lockKey, __ -> new LockState());
        Instant now = clock.instant();
        boolean exclusiveHeldByOther = state.exclusiveOwner != null && !state.exclusiveOwner.equals(instanceId)
                && !state.refreshedAt.plus(lockTimeout).isBefore(now);
        if (lockMode == LockMode.SHARED) {
            if (exclusiveHeldByOther) {
                return false;
            }
            state.sharedHolders.add(instanceId);
            return true;
        }
        if (exclusiveHeldByOther) {
            return false;
        }
        state.exclusiveOwner = instanceId;
        state.refreshedAt = now;
        return true;
    }

    private synchronized void release(String lockKey, String instanceId, LockMode lockMode) {
        LockState state = locks.get(lockKey);
        if (state == null) {
            return;
        }
        if (lockMode == LockMode.SHARED) {
            state.sharedHolders.remove(instanceId);
        } else if (instanceId.equals(state.exclusiveOwner)) {
            state.exclusiveOwner = null;
        }
    }

    private static class LockState {
        private String exclusiveOwner;
        private Instant refreshedAt = Instant.EPOCH;
        private final Set<String> sharedHolders = new HashSet<>();
    }

    private class InMemoryProcessorLock implements ProcessorLock {
        private final String lockKey;
        private final String instanceId;
        private final LockMode lockMode;

        private InMemoryProcessorLock(String lockKey, String instanceId, LockMode lockMode) {
            this.lockKey = lockKey;
            this.instanceId = instanceId;
            this.lockMode = lockMode;
        }

        @Override
        public boolean tryAcquire() {
            return InMemoryProcessorLockFactory.this.tryAcquire(lockKey, instanceId, lockMode);
        }

        @Override
        public void release() {
            InMemoryProcessorLockFactory.this.release(lockKey, instanceId, lockMode);
        }

        @Override
        public String toString() {
            return "InMemoryProcessorLock[" + lockKey + ", " + lockMode + ", " + instanceId + "]";
        }
    }
}
