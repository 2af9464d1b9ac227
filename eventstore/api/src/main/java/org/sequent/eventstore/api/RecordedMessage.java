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

package org.sequent.eventstore.api;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Message} that has been durably appended to a stream.
 *
 * @param message        The message
 * @param streamName     The name of the stream ({@code streamType:streamId})
 * @param streamPosition The position of the message in its stream, starting at 1
 * @param globalPosition The position of the message in the whole store. Backends that assign global positions
 *                       in their change feed (rather than on write) leave this {@code null} when reading a stream.
 * @param created        When the message was appended
 */
public record RecordedMessage(Message message, String streamName, long streamPosition, @Nullable PositionToken globalPosition, Instant created) {

    public RecordedMessage {
        requireNonNull(message, Message.class.getSimpleName() + " cannot be null");
        requireNonNull(streamName, "streamName cannot be null");
        requireNonNull(created, "created cannot be null");
        if (streamPosition < 1) {
            throw new IllegalArgumentException("streamPosition must be greater than 0");
        }
    }

    public MessageKind kind() {
        return message.kind();
    }

    public String type() {
        return message.type();
    }

    public JsonNode data() {
        return message.data();
    }

    public String messageId() {
        return message.messageId();
    }

    public RecordedMessage withGlobalPosition(PositionToken globalPosition) {
        return new RecordedMessage(message, streamName, streamPosition, globalPosition, created);
    }
}
