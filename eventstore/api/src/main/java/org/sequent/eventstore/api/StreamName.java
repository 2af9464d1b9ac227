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

import java.util.Objects;

/**
 * Helpers for stream names of the form {@code streamType:streamId}.
 */
public final class StreamName {
    public static final String UNKNOWN_STREAM_TYPE = "emt:unknown";
    private static final String SEPARATOR = ":";

    private StreamName() {
    }

    public static String of(String streamType, String streamId) {
        Objects.requireNonNull(streamType, "streamType cannot be null");
        Objects.requireNonNull(streamId, "streamId cannot be null");
        return streamType + SEPARATOR + streamId;
    }

    public static String streamType(String streamName) {
        int index = requireValid(streamName).indexOf(SEPARATOR);
        return index <= 0 ? UNKNOWN_STREAM_TYPE : streamName.substring(0, index);
    }

    public static String streamId(String streamName) {
        int index = requireValid(streamName).indexOf(SEPARATOR);
        return index <= 0 ? streamName : streamName.substring(index + 1);
    }

    public static String requireValid(String streamName) {
        Objects.requireNonNull(streamName, "streamName cannot be null");
        if (streamName.isBlank()) {
            throw new IllegalArgumentException("streamName cannot be blank");
        }
        return streamName;
    }
}
