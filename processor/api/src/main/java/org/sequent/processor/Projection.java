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

import org.sequent.eventstore.api.RecordedMessage;

import java.util.Set;

/**
 * A read model that is updated asynchronously by a projector. Each message is handled in the processing scope of
 * the consumer, for PostgreSQL this means in the same transaction as the checkpoint.
 */
public interface Projection {

    String name();

    /**
     * @return The message types that this projection handles. Other messages are skipped but still checkpointed.
     */
    Set<String> canHandle();

    void handle(RecordedMessage message) throws Exception;

    /**
     * Remove everything this projection has stored. Invoked before a projector with {@code truncateOnStart} starts over
     * from the beginning. Does nothing by default.
     */
    default void truncate() throws Exception {
    }
}
