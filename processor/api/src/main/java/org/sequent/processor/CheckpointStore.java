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

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.PositionToken;

/**
 * Stores how far each processor has come in the message feed.
 */
public interface CheckpointStore {

    /**
     * @return The stored checkpoint, or {@code null} if nothing is stored which means that the processor starts from the beginning
     */
    @Nullable PositionToken read(ProcessorKey key);

    /**
     * Store a checkpoint using optimistic concurrency. The first store for a processor, with {@code lastStoredCheckpoint} {@code null},
     * always succeeds if nothing is stored.
     *
     * @param key                  The processor
     * @param lastStoredCheckpoint What the caller believes is currently stored
     * @param newCheckpoint        The checkpoint to store
     * @return The result, see {@link StoreCheckpointResult#classify(PositionToken, PositionToken, PositionToken, boolean)}
     */
    StoreCheckpointResult store(ProcessorKey key, @Nullable PositionToken lastStoredCheckpoint, PositionToken newCheckpoint);

    /**
     * Forget the checkpoint of a processor so that it's read from the beginning the next time. Used when a projection is truncated.
     */
    void reset(ProcessorKey key);
}
