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

import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Options for reading a stream. Both {@code fromPosition} and {@code toPosition} are inclusive.
 */
public record ReadStreamOptions(long fromPosition, @Nullable Long toPosition, ExpectedStreamVersion expectedVersion) {

    public ReadStreamOptions {
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        if (fromPosition < 0) {
            throw new IllegalArgumentException("fromPosition cannot be negative");
        }
        if (toPosition != null && toPosition < fromPosition) {
            throw new IllegalArgumentException("toPosition cannot be less than fromPosition");
        }
    }

    public static ReadStreamOptions all() {
        return new ReadStreamOptions(0, null, ExpectedStreamVersion.any());
    }

    public static ReadStreamOptions from(long fromPosition) {
        return all().withFrom(fromPosition);
    }

    public ReadStreamOptions withFrom(long fromPosition) {
        return new ReadStreamOptions(fromPosition, toPosition, expectedVersion);
    }

    public ReadStreamOptions withTo(long toPosition) {
        return new ReadStreamOptions(fromPosition, toPosition, expectedVersion);
    }

    public ReadStreamOptions withExpectedVersion(ExpectedStreamVersion expectedVersion) {
        return new ReadStreamOptions(fromPosition, toPosition, expectedVersion);
    }

    public boolean includes(long streamPosition) {
        return streamPosition >= fromPosition && (toPosition == null || streamPosition <= toPosition);
    }
}
