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

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.PositionToken;
import org.sequent.processor.CheckpointStore;
import org.sequent.processor.ProcessorKey;
import org.sequent.processor.StoreCheckpointResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CheckpointStore} that keeps checkpoints in memory, useful for tests and demos.
 */
public class InMemoryCheckpointStore implements CheckpointStore {
    private final Map<ProcessorKey, PositionToken> checkpoints = new ConcurrentHashMap<>();

    @Override
    public @Nullable PositionToken read(ProcessorKey key) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        return checkpoints.get(key);
    }

    @Override
    public synchronized StoreCheckpointResult store(ProcessorKey key, @Nullable PositionToken lastStoredCheckpoint, PositionToken newCheckpoint) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        requireNonNull(newCheckpoint, "newCheckpoint cannot be null");
        StoreCheckpointResult.Failure failure = StoreCheckpointResult.classify(checkpoints.get(key), lastStoredCheckpoint, newCheckpoint, false);
        if (failure != null) {
            return failure;
        }
        checkpoints.put(key, newCheckpoint);
        return StoreCheckpointResult.success(newCheckpoint);
    }

    @Override
    public synchronized void reset(ProcessorKey key) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        checkpoints.remove(key);
    }
}
