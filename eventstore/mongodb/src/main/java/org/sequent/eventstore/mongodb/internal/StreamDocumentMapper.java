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

package org.sequent.eventstore.mongodb.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.sequent.eventstore.api.Message;
import org.sequent.eventstore.api.MessageKind;
import org.sequent.eventstore.api.RecordedMessage;

import java.time.Instant;
import java.util.Date;

import static java.util.Objects.requireNonNull;

/**
 * Maps between messages and the sub documents stored in the {@value #MESSAGES} array of a stream document.
 * Also used by the change stream feed to translate appended array elements.
 */
public class StreamDocumentMapper {
    public static final String STREAM_NAME = "streamName";
    public static final String MESSAGES = "messages";
    public static final String METADATA = "metadata";
    public static final String PROJECTIONS = "projections";
    public static final String STREAM_POSITION = METADATA + ".streamPosition";
    public static final String PROJECTION_METADATA = "_metadata";

    private static final String KIND = "kind";
    private static final String TYPE = "type";
    private static final String DATA = "data";
    private static final String MESSAGE_ID = "messageId";
    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private final ObjectMapper objectMapper;

    public StreamDocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
    }

    public Document toDocument(Message message, String streamName, long streamPosition, Instant created) {
        Document metadata = new Document("streamName", streamName)
                .append("streamPosition", streamPosition)
                .append("created", Date.from(created));
        return new Document(KIND, message.kind().code())
                .append(TYPE, message.type())
                .append(DATA, toBson(message.data()))
                .append(MESSAGE_ID, message.messageId())
                .append(METADATA, metadata);
    }

    public RecordedMessage toRecordedMessage(Document document) {
        Document metadata = document.get(METADATA, Document.class);
        Message message = new Message(MessageKind.fromCode(document.getString(KIND)), document.getString(TYPE), toJson(document.get(DATA, Document.class)), document.getString(MESSAGE_ID));
        Number streamPosition = metadata.get("streamPosition", Number.class);
        return new RecordedMessage(message, metadata.getString("streamName"), streamPosition.longValue(), null, metadata.getDate("created").toInstant());
    }

    public Document toBson(JsonNode json) {
        try {
            return Document.parse(objectMapper.writeValueAsString(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize json", e);
        }
    }

    public JsonNode toJson(Document document) {
        try {
            return objectMapper.readTree(document.toJson(RELAXED));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse document", e);
        }
    }
}
