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

import java.util.List;

/**
 * A pull based feed of recorded messages in global order. The consumer owns the feed and is the only caller of
 * {@link #open(StartFrom)} and {@link #nextBatch()}, while {@link #close()} may be called from any thread in order to
 * interrupt a waiting {@code nextBatch}.
 */
public interface MessageFeed {

    /**
     * Start reading from {@code startFrom}. A feed that has been closed can be opened again.
     *
     * @param startFrom A resolved start position, i.e. not {@link StartFrom#current()}
     */
    void open(StartFrom startFrom);

    /**
     * Wait for the next batch of messages. Every message has a global position.
     *
     * @return The next batch, or an empty list if no messages arrived within the feed's wait time or if the feed was closed
     */
    List<RecordedMessage> nextBatch();

    /**
     * Stop reading and release upstream resources. Idempotent.
     */
    void close();
}
