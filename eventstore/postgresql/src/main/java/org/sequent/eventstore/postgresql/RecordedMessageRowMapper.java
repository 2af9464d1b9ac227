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

package org.sequent.eventstore.postgresql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.sequent.eventstore.api.GlobalPosition;
import org.sequent.eventstore.api.Message;
import org.sequent.eventstore.api.MessageKind;
import org.sequent.eventstore.api.RecordedMessage;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

/**
 * Maps a row of {@code emt_messages} to a {@link RecordedMessage}. The query must select all columns listed in {@link #COLUMNS}.
 */
public class RecordedMessageRowMapper implements RowMapper<RecordedMessage> {
    public static final String COLUMNS = "stream_id, stream_position, message_kind, message_type, message_data, message_id, global_position, created";

    private final ObjectMapper objectMapper;

    public RecordedMessageRowMapper(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    @Override
    public RecordedMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
        Message message = new Message(MessageKind.fromCode(rs.getString("message_kind")), rs.getString("message_type"), readJson(rs.getString("message_data")), rs.getString("message_id"));
        return new RecordedMessage(message, rs.getString("stream_id"), rs.getLong("stream_position"), GlobalPosition.of(rs.getLong("global_position")), rs.getObject("created", OffsetDateTime.class).toInstant());
    }

    JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse jsonb column", e);
        }
    }

    String writeJson(JsonNode json) {
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize json", e);
        }
    }
}
