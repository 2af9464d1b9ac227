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

import org.sequent.eventstore.api.PositionToken;

/**
 * Thrown when a processor fails to store its checkpoint because another writer has stored a different checkpoint,
 * typically because the lock was taken over by another instance.
 */
public class ProcessorCheckpointConflictException extends RuntimeException {
    public final String processorId;
    public final StoreCheckpointResult.Reason reason;
    public final PositionToken checkpoint;

    public ProcessorCheckpointConflictException(String processorId, StoreCheckpointResult.Reason reason, PositionToken checkpoint) {
        super(String.format("Failed to store checkpoint %s for processor '%s' (%s)", checkpoint, processorId, reason));
        this.processorId = processorId;
        this.reason = reason;
        this.checkpoint = checkpoint;
    }
}
