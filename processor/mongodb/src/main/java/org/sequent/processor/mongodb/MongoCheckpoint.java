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

package org.sequent.processor.mongodb;

import org.bson.BsonDocument;
import org.bson.BsonString;
import org.sequent.eventstore.api.PositionToken;

import java.util.Arrays;
import java.util.HexFormat;

import static java.util.Objects.requireNonNull;

/**
 * The position of a message in the change stream: the resume token of the change event that carried the message, and
 * the index of the message among the messages appended by that change. Checkpoints are ordered by the unsigned bytes of
 * the resume token and then by index.
 */
public record MongoCheckpoint(String resumeToken, int index) implements PositionToken {
    public static final String PREFIX = "emt:chkpt:mongodb:";

    public MongoCheckpoint {
        requireNonNull(resumeToken, "resumeToken cannot be null");
        if (resumeToken.isBlank() || resumeToken.contains(":")) {
            throw new IllegalArgumentException("Invalid resume token: " + resumeToken);
        }
        if (index < 0) {
            throw new IllegalArgumentException("index cannot be negative");
        }
    }

    public static MongoCheckpoint of(BsonDocument resumeToken, int index) {
        requireNonNull(resumeToken, "resumeToken cannot be null");
        return new MongoCheckpoint(resumeToken.getString("_data").getValue(), index);
    }

    /**
     * @param value A checkpoint in the form {@code emt:chkpt:mongodb:<resume token>:<index>}
     */
    public static MongoCheckpoint parse(String value) {
        requireNonNull(value, "value cannot be null");
        int indexSeparator = value.lastIndexOf(':');
        if (!value.startsWith(PREFIX) || indexSeparator < PREFIX.length()) {
            throw new IllegalArgumentException("Invalid MongoDB checkpoint: " + value);
        }
        try {
            return new MongoCheckpoint(value.substring(PREFIX.length(), indexSeparator), Integer.parseInt(value.substring(indexSeparator + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid MongoDB checkpoint: " + value, e);
        }
    }

    /**
     * @return The resume token in the form accepted by {@code startAfter}
     */
    public BsonDocument resumeTokenDocument() {
        return new BsonDocument("_data", new BsonString(resumeToken));
    }

    @Override
    public String asString() {
        return PREFIX + resumeToken + ":" + index;
    }

    @Override
    public int compareTo(PositionToken other) {
        if (!(other instanceof MongoCheckpoint checkpoint)) {
            throw new IllegalStateException("Type of tokens is not comparable: " + getClass().getSimpleName() + " and " + other.getClass().getSimpleName());
        }
        int tokenComparison = Arrays.compareUnsigned(HexFormat.of().parseHex(resumeToken), HexFormat.of().parseHex(checkpoint.resumeToken));
        return tokenComparison != 0 ? tokenComparison : Integer.compare(index, checkpoint.index);
    }

    @Override
    public String toString() {
        return asString();
    }
}
