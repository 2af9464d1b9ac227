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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The result of {@link CheckpointStore#store(ProcessorKey, PositionToken, PositionToken)}. A failure is an ordinary
 * outcome of racing writers and not an exception.
 */
public sealed interface StoreCheckpointResult {

    static StoreCheckpointResult success(PositionToken newCheckpoint) {
        return new Success(newCheckpoint);
    }

    static StoreCheckpointResult failure(Reason reason) {
        return new Failure(reason);
    }

    /**
     * Classify a store request against the checkpoint that is currently stored. A checkpoint is only written if the caller's
     * view of the stored checkpoint is correct and the new checkpoint is after it.
     *
     * @param current                   The currently stored checkpoint or {@code null} if none is stored
     * @param lastStored                What the caller believes is stored
     * @param newCheckpoint             The checkpoint to store
     * @param distinguishCurrentAhead   Whether to report {@link Reason#CURRENT_AHEAD} instead of {@link Reason#MISMATCH} when the stored checkpoint is after {@code newCheckpoint}
     * @return {@code null} if the checkpoint should be written, otherwise the failure
     */
    static @Nullable Failure classify(@Nullable PositionToken current, @Nullable PositionToken lastStored, PositionToken newCheckpoint, boolean distinguishCurrentAhead) {
        boolean checkMatches = PositionToken.compare(current, lastStored) == 0;
        if (checkMatches) {
            return current != null && PositionToken.compare(newCheckpoint, current) <= 0 ? new Failure(Reason.IGNORED) : null;
        } else if (distinguishCurrentAhead && PositionToken.compare(current, newCheckpoint) > 0) {
            return new Failure(Reason.CURRENT_AHEAD);
        }
        return new Failure(Reason.MISMATCH);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    enum Reason {
        /**
         * The new checkpoint is at or before the stored one, the processor has already caught up.
         */
        IGNORED,
        /**
         * The caller's view of the stored checkpoint is stale, another writer has progressed differently.
         */
        MISMATCH,
        /**
         * The stored checkpoint is after the new one and doesn't match the caller's view.
         */
        CURRENT_AHEAD
    }

    record Success(PositionToken newCheckpoint) implements StoreCheckpointResult {
        public Success {
            requireNonNull(newCheckpoint, "newCheckpoint cannot be null");
        }
    }

    record Failure(Reason reason) implements StoreCheckpointResult {
        public Failure {
            Objects.requireNonNull(reason, Reason.class.getSimpleName() + " cannot be null");
        }
    }
}
