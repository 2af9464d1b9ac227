/*
 * Copyright 2020 Johan Haleby
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

package org.sequent.eventstore.api;

import java.util.List;
import java.util.function.BiFunction;

import static java.util.Objects.requireNonNull;

/**
 * An append-only store of message streams with optimistic concurrency control.
 * <p>
 * Appends are atomic: either all messages are written and the stream position is advanced, or nothing is written.
 * Inline projections registered with the store run inside the same atomic unit, after-commit hooks run after it
 * has been committed.
 */
public interface EventStore {

    /**
     * Append messages to a stream, creating the stream if it doesn't exist.
     *
     * @param streamName      The name of the stream, typically {@code streamType:streamId}
     * @param messages        The messages to append
     * @param expectedVersion The version the stream is expected to have before the append
     * @return The {@link AppendResult}
     * @throws ExpectedVersionConflictException If {@code expectedVersion} doesn't match the current version of the stream
     */
    AppendResult appendToStream(String streamName, List<Message> messages, ExpectedStreamVersion expectedVersion);

    /**
     * Append messages to a stream regardless of its current version.
     */
    default AppendResult appendToStream(String streamName, List<Message> messages) {
        return appendToStream(streamName, messages, ExpectedStreamVersion.any());
    }

    /**
     * Read a stream.
     *
     * @throws ExpectedVersionConflictException If an expected version is specified in the {@code options} and it doesn't match the current version of the stream
     */
    ReadStreamResult readStream(String streamName, ReadStreamOptions options);

    default ReadStreamResult readStream(String streamName) {
        return readStream(streamName, ReadStreamOptions.all());
    }

    /**
     * Read a stream and fold {@code evolve} over its messages from left to right, starting with {@code initialState}.
     */
    default <S> AggregateStreamResult<S> aggregateStream(String streamName, S initialState, BiFunction<S, RecordedMessage, S> evolve, ReadStreamOptions options) {
        requireNonNull(evolve, "evolve cannot be null");
        ReadStreamResult result = readStream(streamName, options);
        S state = initialState;
        for (RecordedMessage message : result.messages()) {
            state = evolve.apply(state, message);
        }
        return new AggregateStreamResult<>(state, result.currentStreamVersion(), result.streamExists());
    }

    default <S> AggregateStreamResult<S> aggregateStream(String streamName, S initialState, BiFunction<S, RecordedMessage, S> evolve) {
        return aggregateStream(streamName, initialState, evolve, ReadStreamOptions.all());
    }
}
