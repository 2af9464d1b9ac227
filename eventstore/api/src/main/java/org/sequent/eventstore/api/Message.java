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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A message (event or command) as it is handed to an {@link EventStore}. The {@code messageId} is globally unique,
 * use {@link #event(String, JsonNode)} or {@link #command(String, JsonNode)} to get a random one.
 *
 * @param kind      Event or command
 * @param type      The message type, for example {@code ProductItemAdded}
 * @param data      The payload, must be a json object
 * @param messageId The globally unique id of the message
 */
public record Message(MessageKind kind, String type, JsonNode data, String messageId) {

    public Message {
        requireNonNull(kind, MessageKind.class.getSimpleName() + " cannot be null");
        requireNonNull(type, "type cannot be null");
        requireNonNull(messageId, "messageId cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        data = data == null ? JsonNodeFactory.instance.objectNode() : data;
        if (!data.isObject()) {
            throw new IllegalArgumentException("data must be a json object but was " + data.getNodeType());
        }
    }

    public static Message event(String type, JsonNode data) {
        return new Message(MessageKind.EVENT, type, data, UUID.randomUUID().toString());
    }

    public static Message event(String type) {
        return event(type, JsonNodeFactory.instance.objectNode());
    }

    public static Message command(String type, JsonNode data) {
        return new Message(MessageKind.COMMAND, type, data, UUID.randomUUID().toString());
    }

    public Message withMessageId(String messageId) {
        return new Message(kind, type, data, messageId);
    }
}
