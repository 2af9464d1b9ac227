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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The expected version of a stream didn't match its actual version so nothing has been written to the event store.
 * In a typical scenario, if an application reads and writes stream A from two different places at the same time,
 * this is effectively the same as an optimistic locking exception. The core never retries on its own, it's up to
 * the caller to re-read the stream and try again.
 */
public class ExpectedVersionConflictException extends RuntimeException {
    public final String streamName;
    public final ExpectedStreamVersion expectedVersion;
    public final long actualVersion;

    public ExpectedVersionConflictException(String streamName, ExpectedStreamVersion expectedVersion, long actualVersion) {
        this(streamName, expectedVersion, actualVersion, null);
    }

    public ExpectedVersionConflictException(String streamName, ExpectedStreamVersion expectedVersion, long actualVersion, Throwable cause) {
        super(String.format("Expected version %s but was %d for stream '%s'.", expectedVersion, actualVersion, streamName), cause);
        this.streamName = streamName;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpectedVersionConflictException that)) return false;
        return actualVersion == that.actualVersion && Objects.equals(streamName, that.streamName) && Objects.equals(expectedVersion, that.expectedVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ExpectedVersionConflictException.class.getSimpleName() + "[", "]")
                .add("streamName='" + streamName + "'")
                .add("expectedVersion=" + expectedVersion)
                .add("actualVersion=" + actualVersion)
                .toString();
    }
}
